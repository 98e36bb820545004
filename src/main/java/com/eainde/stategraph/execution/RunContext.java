package com.eainde.stategraph.execution;

import com.eainde.stategraph.RunOptions;
import com.eainde.stategraph.state.StateStore;

/**
 * Everything one run owns, shared between the engine and the node wrappers of the run.
 */
record RunContext(RunOptions options,
                  IterationGuard guard,
                  ExecutionContext context,
                  StateStore store,
                  RunEvents events) {

    String runId() {
        return context.getRunId();
    }
}
