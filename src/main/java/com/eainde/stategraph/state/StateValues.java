package com.eainde.stategraph.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for the values that enter and leave run state.
 */
public final class StateValues {

    /** Prefix of keys the engine keeps in the runtime state for its own bookkeeping. */
    public static final String INTERNAL_PREFIX = "__";

    private StateValues() {
    }

    /**
     * Shallow, unmodifiable copy of a container value; any other value is returned as is.
     * Values written to the state never alias a caller's list, set or map.
     */
    public static Object immutableCopy(Object value) {
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        if (value instanceof Set<?> set) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(set));
        }
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }
        if (value instanceof Collection<?> collection) {
            return Collections.unmodifiableList(new ArrayList<>(collection));
        }
        return value;
    }

    /**
     * @return a copy of {@code update} whose container values are {@link #immutableCopy copied};
     *         empty for {@code null}
     */
    public static Map<String, Object> immutableCopyOf(Map<String, Object> update) {
        if (update == null || update.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        update.forEach((key, value) -> copy.put(key, immutableCopy(value)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * @return {@code state} without the engine's internal keys
     */
    public static Map<String, Object> withoutInternalKeys(Map<String, Object> state) {
        Map<String, Object> visible = new LinkedHashMap<>();
        state.forEach((key, value) -> {
            if (!key.startsWith(INTERNAL_PREFIX)) {
                visible.put(key, value);
            }
        });
        return Collections.unmodifiableMap(visible);
    }
}
