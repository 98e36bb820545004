package com.eainde.stategraph.listener;

import com.eainde.stategraph.exception.GraphRunnerException;
import com.eainde.stategraph.execution.ExecutionContext;
import lombok.extern.log4j.Log4j2;

import java.util.Map;

/**
 * Logs node transitions at DEBUG and failed runs at WARN.
 */
@Log4j2
public class LoggingGraphListener implements GraphListener {

    @Override
    public void onRunStart(String runId, Map<String, Object> initialState) {
        log.debug("[{}] run started with fields {}", runId, initialState.keySet());
    }

    @Override
    public void beforeNode(String runId, String nodeId, ExecutionContext context) {
        log.debug("[{}] step {} → {}", runId, context.getIterationCount() + 1, nodeId);
    }

    @Override
    public void afterNode(String runId, String nodeId, Map<String, Object> update,
                          Map<String, Object> state, ExecutionContext context) {
        log.debug("[{}] {} updated {}", runId, nodeId, update == null ? "[]" : update.keySet());
    }

    @Override
    public void onRunComplete(String runId, Map<String, Object> finalState, ExecutionContext context) {
        log.debug("[{}] run completed, path={}", runId, context.getPath());
    }

    @Override
    public void onRunError(String runId, GraphRunnerException error) {
        log.warn("[{}] run aborted after {} step(s): {}", runId, error.getStepCount(), error.getMessage());
    }
}
