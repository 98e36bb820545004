package com.eainde.stategraph.exception;

import java.util.List;

/**
 * A node's step function threw or completed exceptionally. The failing node is
 * not part of {@link #getPath()}; it is reported by {@link #getNodeId()}.
 */
public class StepExecutionException extends GraphRunnerException {

    private final String nodeId;

    public StepExecutionException(String nodeId, Throwable cause, String runId, List<String> path) {
        super("Node '" + nodeId + "' failed: " + cause + " (path: " + path + ")", cause, runId, path);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
