package com.eainde.stategraph.exception;

import java.util.List;

/**
 * Base type of every error that aborts a graph run.
 * <p>
 * Each subclass carries the run id and the path of node ids executed before the
 * run was aborted, so callers can diagnose a failed run without any partial state
 * being handed back as a result.
 */
public abstract class GraphRunnerException extends RuntimeException {

    private final String runId;
    private final List<String> path;

    protected GraphRunnerException(String message, Throwable cause, String runId, List<String> path) {
        super(message, cause);
        this.runId = runId;
        this.path = path == null ? List.of() : List.copyOf(path);
    }

    public String getRunId() {
        return runId;
    }

    /**
     * @return node ids in execution order, oldest first
     */
    public List<String> getPath() {
        return path;
    }

    public int getStepCount() {
        return path.size();
    }
}
