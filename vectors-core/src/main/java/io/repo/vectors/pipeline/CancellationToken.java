package io.repo.vectors.pipeline;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag, checked between files and between embedding batches.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    /**
     * Returns a fresh token that nobody else holds.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Indexing cancelled");
        }
    }
}
