package com.eainde.stategraph.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal flipped by the caller, usually from another thread.
 */
public final class CancellationToken implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
