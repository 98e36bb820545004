package com.eainde.stategraph.execution;

import com.eainde.stategraph.exception.IterationLimitExceededException;

import java.util.Map;

/**
 * Bounds the number of node executions in one run.
 * <p>
 * Checked after every node execution whose successor is not END, so a run either
 * reaches END within {@code maxSteps} executions or is aborted after exactly
 * {@code maxSteps}. Nothing in the state or the graph can bypass it.
 */
public final class IterationGuard {

    private final int maxSteps;

    public IterationGuard(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public boolean isExhausted(ExecutionContext context) {
        return context.getIterationCount() >= maxSteps;
    }

    /**
     * @throws IterationLimitExceededException if the run has used up its steps
     */
    public void check(ExecutionContext context, Map<String, Object> lastState) {
        if (isExhausted(context)) {
            throw new IterationLimitExceededException(maxSteps, lastState, context.getRunId(), context.getPath());
        }
    }
}
