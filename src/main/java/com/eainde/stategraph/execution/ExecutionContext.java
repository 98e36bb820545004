package com.eainde.stategraph.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Path and step count of one run. Written only by the engine's node wrappers;
 * listeners and errors see it through the read-only accessors.
 */
public final class ExecutionContext {

    private final String runId;
    private final List<String> path = new ArrayList<>();
    private int iterationCount;
    private String currentNode;

    ExecutionContext(String runId) {
        this.runId = runId;
    }

    synchronized void enter(String nodeId) {
        currentNode = nodeId;
    }

    synchronized void recordExecution(String nodeId) {
        path.add(nodeId);
        iterationCount++;
    }

    public String getRunId() {
        return runId;
    }

    public synchronized List<String> getPath() {
        return List.copyOf(path);
    }

    public synchronized int getIterationCount() {
        return iterationCount;
    }

    public synchronized Optional<String> getLastNode() {
        return path.isEmpty() ? Optional.empty() : Optional.of(path.get(path.size() - 1));
    }

    /**
     * @return the node most recently started, whether or not it completed
     */
    public synchronized Optional<String> getCurrentNode() {
        return Optional.ofNullable(currentNode);
    }

    @Override
    public synchronized String toString() {
        return "ExecutionContext[runId=" + runId + ", iterationCount=" + iterationCount + ", path=" + path + "]";
    }
}
