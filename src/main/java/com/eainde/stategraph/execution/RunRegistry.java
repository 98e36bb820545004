package com.eainde.stategraph.execution;

import org.bsc.langgraph4j.RunnableConfig;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs in progress on one workflow, keyed by the thread id the graph runtime passes
 * back to every node. This is how a node wrapper finds the store, guard and context
 * of the run it is executing in.
 */
public final class RunRegistry {

    private final Map<String, RunContext> active = new ConcurrentHashMap<>();

    void register(RunContext run) {
        if (active.putIfAbsent(run.runId(), run) != null) {
            throw new IllegalStateException("Run " + run.runId() + " is already in progress on this workflow");
        }
    }

    RunContext lookup(RunnableConfig config) {
        String runId = config.threadId()
                .orElseThrow(() -> new IllegalStateException("Runtime config carries no thread id"));
        RunContext run = active.get(runId);
        if (run == null) {
            throw new IllegalStateException("No run " + runId + " in progress; start runs through Workflow.invoke/run");
        }
        return run;
    }

    void remove(String runId) {
        active.remove(runId);
    }

    public int activeCount() {
        return active.size();
    }
}
