package com.teknolojikpanda.codereview.api;

import javax.annotation.Nullable;

/**
 * Signals that an in-progress review session was canceled.
 */
public class ReviewCanceledException extends RuntimeException {

    private final String runId;

    public ReviewCanceledException(String runId, @Nullable String message) {
        super(message != null ? message : "Review session canceled.");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
