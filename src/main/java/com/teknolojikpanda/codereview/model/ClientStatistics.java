package com.teknolojikpanda.codereview.model;

import javax.annotation.Nullable;

/**
 * Point-in-time copy of the remote client's success/failure counters.
 */
public final class ClientStatistics {

    private final int successCount;
    private final int failureCount;
    private final String lastError;

    public ClientStatistics(int successCount, int failureCount, @Nullable String lastError) {
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.lastError = lastError;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    @Nullable
    public String getLastError() {
        return lastError;
    }
}
