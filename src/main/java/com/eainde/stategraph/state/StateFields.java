package com.eainde.stategraph.state;

import org.bsc.langgraph4j.state.Reducer;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Factory methods for the common field shapes.
 *
 * <pre>
 * StateSchema.of(
 *         StateFields.value("currentStep", String.class),
 *         StateFields.appender("history"),
 *         StateFields.counter("total"),
 *         StateFields.mergedMap("workerResults"));
 * </pre>
 */
public final class StateFields {

    private StateFields() {
    }

    /** Last write wins, no default. */
    public static <T> StateField<T> value(String name, Class<T> type) {
        return new StateField<>(name, type, Reducers.replace(), null);
    }

    /** Last write wins, starts at {@code defaultValue}. */
    public static <T> StateField<T> value(String name, Class<T> type, T defaultValue) {
        return new StateField<>(name, type, Reducers.replace(), () -> defaultValue);
    }

    /** List concatenation, starts empty. */
    public static StateField<List<Object>> appender(String name) {
        return new StateField<>(name, List.class, Reducers.appendList(), List::of);
    }

    /** Numeric sum, starts at 0. */
    public static StateField<Number> counter(String name) {
        return new StateField<>(name, Number.class, Reducers.sum(), () -> 0);
    }

    /** Shallow map merge where incoming keys win, starts empty. */
    public static StateField<Map<Object, Object>> mergedMap(String name) {
        return new StateField<>(name, Map.class, Reducers.mergeMap(), Map::of);
    }

    public static <T> StateField<T> of(String name, Class<?> type, Reducer<T> reducer, Supplier<T> defaultValue) {
        return new StateField<>(name, type, reducer, defaultValue);
    }
}
