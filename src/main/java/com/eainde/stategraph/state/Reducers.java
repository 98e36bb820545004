package com.eainde.stategraph.state;

import org.bsc.langgraph4j.state.Reducer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in reducers, usable both by the typed merge in {@link StateStore} and by the
 * graph runtime's channels (see {@link StateField#toChannel()}).
 *
 * <pre>
 *   replace()    : (old, new) → new
 *   appendList() : ([a], [b]) → [a, b]
 *   sum()        : (10, 20)   → 30
 *   mergeMap()   : ({a:1}, {a:2, b:3}) → {a:2, b:3}
 * </pre>
 */
public final class Reducers {

    private static final Reducer<Object> REPLACE = (current, incoming) -> incoming;

    private static final Reducer<List<Object>> APPEND_LIST = Reducers::append;

    private static final Reducer<Number> SUM = Reducers::add;

    private static final Reducer<Map<Object, Object>> MERGE_MAP = Reducers::shallowMerge;

    private Reducers() {
    }

    @SuppressWarnings("unchecked")
    public static <T> Reducer<T> replace() {
        return (Reducer<T>) REPLACE;
    }

    /**
     * @return true if the given reducer is the shared {@link #replace()} instance
     */
    public static boolean isReplace(Reducer<?> reducer) {
        return reducer == REPLACE;
    }

    public static Reducer<List<Object>> appendList() {
        return APPEND_LIST;
    }

    public static Reducer<Number> sum() {
        return SUM;
    }

    public static Reducer<Map<Object, Object>> mergeMap() {
        return MERGE_MAP;
    }

    // =========================================================================
    //  Implementations
    // =========================================================================

    private static List<Object> append(List<Object> current, List<Object> incoming) {
        List<Object> merged = new ArrayList<>(sizeOf(current) + sizeOf(incoming));
        if (current != null) merged.addAll(current);
        if (incoming != null) merged.addAll(incoming);
        return Collections.unmodifiableList(merged);
    }

    private static Map<Object, Object> shallowMerge(Map<Object, Object> current, Map<Object, Object> incoming) {
        Map<Object, Object> merged = new LinkedHashMap<>();
        if (current != null) merged.putAll(current);
        if (incoming != null) merged.putAll(incoming);
        return Collections.unmodifiableMap(merged);
    }

    /**
     * Adds two numbers keeping the narrowest type that holds both operands:
     * Integer, then Long, then BigInteger, then Double, then BigDecimal.
     * An Integer sum that overflows is returned as a Long, a Long sum as a BigInteger.
     */
    private static Number add(Number current, Number incoming) {
        if (current == null) return incoming;
        if (incoming == null) return current;

        if (isIntegral(current) && isIntegral(incoming)) {
            if (current instanceof BigInteger || incoming instanceof BigInteger) {
                return toBigInteger(current).add(toBigInteger(incoming));
            }
            if (current instanceof Long || incoming instanceof Long) {
                return addLong(current.longValue(), incoming.longValue());
            }
            return addInt(current.intValue(), incoming.intValue());
        }
        if (current instanceof BigDecimal || incoming instanceof BigDecimal
                || current instanceof BigInteger || incoming instanceof BigInteger) {
            return toBigDecimal(current).add(toBigDecimal(incoming));
        }
        if (isFloating(current) || isFloating(incoming)) {
            return current.doubleValue() + incoming.doubleValue();
        }
        throw new IllegalArgumentException("Unsupported number types: "
                + current.getClass().getSimpleName() + " + " + incoming.getClass().getSimpleName());
    }

    private static Number addInt(int a, int b) {
        long sum = (long) a + b;
        if (sum != (int) sum) {
            return sum;
        }
        return (int) sum;
    }

    private static Number addLong(long a, long b) {
        long sum = a + b;
        // overflow iff both operands have the sign the result lacks
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return BigInteger.valueOf(a).add(BigInteger.valueOf(b));
        }
        return sum;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger big ? big : BigInteger.valueOf(n.longValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal big) return big;
        if (n instanceof BigInteger big) return new BigDecimal(big);
        if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
        return BigDecimal.valueOf(n.doubleValue());
    }

    private static int sizeOf(Collection<?> c) {
        return c == null ? 0 : c.size();
    }
}
