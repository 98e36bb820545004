package com.eainde.stategraph.exception;

import java.util.List;
import java.util.Map;

/**
 * The run executed its maximum number of nodes without reaching END.
 */
public class IterationLimitExceededException extends GraphRunnerException {

    private final int maxSteps;
    private final Map<String, Object> lastState;

    public IterationLimitExceededException(int maxSteps, Map<String, Object> lastState,
                                           String runId, List<String> path) {
        super("Iteration limit of " + maxSteps + " reached without hitting END (path: " + path + ")",
                null, runId, path);
        this.maxSteps = maxSteps;
        this.lastState = lastState == null ? Map.of() : lastState;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    /**
     * @return the read-only state snapshot after the last executed node
     */
    public Map<String, Object> getLastState() {
        return lastState;
    }
}
