package com.eainde.stategraph.execution;

import com.eainde.stategraph.exception.GraphRunnerException;
import com.eainde.stategraph.listener.GraphListener;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fans run events out to the configured listeners. Their failures are logged and
 * never reach the run.
 */
@Log4j2
final class RunEvents {

    private final String runId;
    private final List<GraphListener> listeners;

    RunEvents(String runId, List<GraphListener> listeners) {
        this.runId = runId;
        this.listeners = listeners;
    }

    void runStarted(Map<String, Object> initialState) {
        notifyListeners("onRunStart", l -> l.onRunStart(runId, initialState));
    }

    void beforeNode(String nodeId, ExecutionContext context) {
        notifyListeners("beforeNode", l -> l.beforeNode(runId, nodeId, context));
    }

    void afterNode(String nodeId, Map<String, Object> update, Map<String, Object> state,
                   ExecutionContext context) {
        notifyListeners("afterNode", l -> l.afterNode(runId, nodeId, update, state, context));
    }

    void runCompleted(Map<String, Object> finalState, ExecutionContext context) {
        notifyListeners("onRunComplete", l -> l.onRunComplete(runId, finalState, context));
    }

    void runFailed(GraphRunnerException error) {
        notifyListeners("onRunError", l -> l.onRunError(runId, error));
    }

    private void notifyListeners(String event, Consumer<GraphListener> callback) {
        for (GraphListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} for run {}",
                        listener.getClass().getSimpleName(), event, runId, e);
            }
        }
    }
}
