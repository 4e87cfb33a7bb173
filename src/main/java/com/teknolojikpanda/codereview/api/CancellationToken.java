package com.teknolojikpanda.codereview.api;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a running session.
 */
public class CancellationToken {

    /** Token that can never be cancelled. */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void throwIfCancellationRequested(String runId) {
        if (cancelled.get()) {
            throw new ReviewCanceledException(runId, "Review session canceled by caller.");
        }
    }
}
