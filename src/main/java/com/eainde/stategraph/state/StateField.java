package com.eainde.stategraph.state;

import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Declaration of one state field: its name, the type every written value must
 * have, the reducer that folds updates into it and an optional default.
 * <p>
 * {@link #toChannel()} hands the same reducer and default to the graph runtime, so the
 * state the runtime keeps is the state {@link StateStore} previews.
 *
 * @param name         field name, unique within a {@link StateSchema}
 * @param type         raw type incoming values are checked against
 * @param reducer      merge function; {@link Reducers#replace()} when the field has no accumulation
 * @param defaultValue supplier of the value the field holds before any write, or {@code null}
 * @param <T>          value type
 */
public record StateField<T>(String name, Class<?> type, Reducer<T> reducer, Supplier<T> defaultValue) {

    public StateField {
        Objects.requireNonNull(name, "field name must not be null");
        Objects.requireNonNull(type, "field type must not be null");
        Objects.requireNonNull(reducer, "reducer must not be null for field: " + name);
        if (name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        if (name.startsWith(StateValues.INTERNAL_PREFIX)) {
            throw new IllegalArgumentException("field names starting with '" + StateValues.INTERNAL_PREFIX
                    + "' are reserved: " + name);
        }
    }

    public boolean accepts(Object value) {
        return type.isInstance(value);
    }

    public boolean isReplace() {
        return Reducers.isReplace(reducer);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Channel<T> toChannel() {
        return hasDefault() ? Channels.base(reducer, defaultValue) : Channels.base(reducer);
    }

    @Override
    public String toString() {
        return name + ":" + type.getSimpleName() + (isReplace() ? "" : " (accumulating)");
    }
}
