package com.eainde.stategraph.listener;

import com.eainde.stategraph.exception.GraphRunnerException;
import com.eainde.stategraph.execution.ExecutionContext;

import java.util.Map;

/**
 * Callback interface notified of run and node lifecycle events.
 * <p>
 * Listeners run on the thread executing the graph. A listener that throws is logged
 * and skipped; it never aborts the run.
 * <p>
 * Register with {@code CompileOptions.builder().listener(..)}.
 */
public interface GraphListener {

    default void onRunStart(String runId, Map<String, Object> initialState) {
    }

    default void beforeNode(String runId, String nodeId, ExecutionContext context) {
    }

    /**
     * @param update the partial update the node returned
     * @param state  the state after the update was merged
     */
    default void afterNode(String runId, String nodeId, Map<String, Object> update,
                           Map<String, Object> state, ExecutionContext context) {
    }

    default void onRunComplete(String runId, Map<String, Object> finalState, ExecutionContext context) {
    }

    default void onRunError(String runId, GraphRunnerException error) {
    }
}
