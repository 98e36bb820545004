package com.eainde.stategraph.exception;

import java.util.List;

/**
 * The run observed its cancellation signal between two node executions.
 */
public class RunCancelledException extends GraphRunnerException {

    public RunCancelledException(String runId, List<String> path) {
        this(runId, path, null);
    }

    public RunCancelledException(String runId, List<String> path, Throwable cause) {
        super("Run " + runId + " cancelled after " + path.size() + " step(s) (path: " + path + ")",
                cause, runId, path);
    }
}
