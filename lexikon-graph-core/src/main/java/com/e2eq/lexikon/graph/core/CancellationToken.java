package com.e2eq.lexikon.graph.core;

import com.e2eq.lexikon.graph.exceptions.InferenceCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag polled by the orchestrator between hops.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void throwIfCancelled(String sourceTermId, int completedHops) {
        if (cancelled.get()) {
            throw new InferenceCancelledException(sourceTermId, completedHops);
        }
    }
}
