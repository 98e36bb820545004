package com.eainde.stategraph.state;

import com.eainde.stategraph.exception.StateMergeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Holds the state of one run and is its only writer.
 * <p>
 * Every partial update is merged field by field on a private copy; the copy is
 * published as the new snapshot only if every field merged. A failed update
 * leaves the previous snapshot in place.
 * <p>
 * Snapshots are unmodifiable maps and stay valid after later updates. Incoming lists,
 * sets and maps are copied before they are merged, so a caller that keeps a reference
 * to a value it returned cannot change the run state through it.
 */
public final class StateStore {

    private final StateSchema schema;
    private volatile Map<String, Object> snapshot;

    public StateStore(StateSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.snapshot = schema.defaults();
    }

    public Map<String, Object> snapshot() {
        return snapshot;
    }

    /**
     * Merges {@code partialUpdate} into the current snapshot.
     *
     * @param partialUpdate field → incoming value; {@code null} or empty is a no-op
     * @return the new snapshot
     * @throws StateMergeException if any field cannot be merged; nothing is applied in that case
     */
    public synchronized Map<String, Object> apply(Map<String, Object> partialUpdate) {
        if (partialUpdate == null || partialUpdate.isEmpty()) {
            return snapshot;
        }

        Map<String, Object> next = new LinkedHashMap<>(snapshot);
        for (Map.Entry<String, Object> entry : partialUpdate.entrySet()) {
            mergeField(next, entry.getKey(), entry.getValue());
        }

        snapshot = Collections.unmodifiableMap(next);
        return snapshot;
    }

    private void mergeField(Map<String, Object> target, String field, Object incoming) {
        Object current = target.get(field);
        StateField<Object> declared = schema.<Object>field(field)
                .orElseThrow(() -> new StateMergeException(field, current, incoming,
                        "field is not declared in the state schema", null));

        if (incoming == null) {
            throw new StateMergeException(field, current, null,
                    "null is not a value; leave the field out of the update to keep it", null);
        }

        if (!declared.accepts(incoming)) {
            throw new StateMergeException(field, current, incoming,
                    "expected a value of type " + declared.type().getSimpleName(), null);
        }

        Object merged;
        try {
            merged = declared.reducer().apply(current, StateValues.immutableCopy(incoming));
        } catch (RuntimeException e) {
            throw new StateMergeException(field, current, incoming,
                    "reducer failed: " + e.getMessage(), e);
        }

        if (merged == null) {
            target.remove(field);
        } else {
            target.put(field, StateValues.immutableCopy(merged));
        }
    }
}
