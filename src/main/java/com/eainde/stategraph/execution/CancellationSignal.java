package com.eainde.stategraph.execution;

/**
 * Polled by the engine between node executions; never while a step is running.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}
