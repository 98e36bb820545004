package com.eainde.stategraph.state;

import org.bsc.langgraph4j.state.Channel;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of {@link StateField}s describing every field a graph's state may hold.
 * <p>
 * The schema doubles as the reducer registry: the {@link StateStore} looks up each
 * incoming field here and rejects fields that were never declared, and
 * {@link #channels()} gives the graph runtime the same reducers.
 */
public final class StateSchema {

    private final Map<String, StateField<?>> fields;

    private StateSchema(Map<String, StateField<?>> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static StateSchema of(StateField<?>... fields) {
        Builder builder = builder();
        Arrays.stream(fields).forEach(builder::field);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<StateField<T>> field(String name) {
        return Optional.ofNullable((StateField<T>) fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Collection<StateField<?>> fields() {
        return fields.values();
    }

    /**
     * @return field name → runtime channel carrying the field's reducer and default
     */
    public Map<String, Channel<?>> channels() {
        Map<String, Channel<?>> channels = new LinkedHashMap<>();
        fields.forEach((name, field) -> channels.put(name, field.toChannel()));
        return channels;
    }

    /**
     * @return the value every field with a default holds before the first write
     */
    public Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (StateField<?> field : fields.values()) {
            if (field.hasDefault()) {
                Object value = field.defaultValue().get();
                if (value != null) {
                    defaults.put(field.name(), value);
                }
            }
        }
        return Collections.unmodifiableMap(defaults);
    }

    @Override
    public String toString() {
        return "StateSchema" + fields.values();
    }

    // ==========================================================================
    //  Builder
    // ==========================================================================

    public static class Builder {
        private final Map<String, StateField<?>> fields = new LinkedHashMap<>();

        public Builder field(StateField<?> field) {
            Objects.requireNonNull(field, "field must not be null");
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Field already declared: " + field.name());
            }
            return this;
        }

        public <T> Builder value(String name, Class<T> type) {
            return field(StateFields.value(name, type));
        }

        public Builder appender(String name) {
            return field(StateFields.appender(name));
        }

        public Builder counter(String name) {
            return field(StateFields.counter(name));
        }

        public Builder mergedMap(String name) {
            return field(StateFields.mergedMap(name));
        }

        public StateSchema build() {
            return new StateSchema(fields);
        }
    }
}
