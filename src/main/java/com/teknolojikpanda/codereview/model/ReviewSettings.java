package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Immutable runtime settings for a review session and its remote client.
 */
public final class ReviewSettings {

    private final String providerId;
    private final ConnectionMode connectionMode;
    private final String proxyUrl;
    private final long pacingDelayMs;
    private final int connectTimeoutMs;
    private final int requestTimeoutMs;
    private final int maxFiles;
    private final int largeFileThreshold;

    private ReviewSettings(Builder builder) {
        this.providerId = Objects.requireNonNull(builder.providerId, "providerId");
        this.connectionMode = Objects.requireNonNull(builder.connectionMode, "connectionMode");
        this.proxyUrl = builder.proxyUrl != null ? builder.proxyUrl : "";
        this.pacingDelayMs = Math.max(0, builder.pacingDelayMs);
        this.connectTimeoutMs = Math.max(1, builder.connectTimeoutMs);
        this.requestTimeoutMs = Math.max(1, builder.requestTimeoutMs);
        this.maxFiles = Math.max(1, builder.maxFiles);
        this.largeFileThreshold = Math.max(1, builder.largeFileThreshold);
    }

    public static ReviewSettings defaults() {
        return builder().build();
    }

    @Nonnull
    public String getProviderId() {
        return providerId;
    }

    @Nonnull
    public ConnectionMode getConnectionMode() {
        return connectionMode;
    }

    @Nonnull
    public String getProxyUrl() {
        return proxyUrl;
    }

    public long getPacingDelayMs() {
        return pacingDelayMs;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public int getLargeFileThreshold() {
        return largeFileThreshold;
    }

    public Builder toBuilder() {
        return builder()
                .providerId(providerId)
                .connectionMode(connectionMode)
                .proxyUrl(proxyUrl)
                .pacingDelayMs(pacingDelayMs)
                .connectTimeoutMs(connectTimeoutMs)
                .requestTimeoutMs(requestTimeoutMs)
                .maxFiles(maxFiles)
                .largeFileThreshold(largeFileThreshold);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String providerId = "deepseek-chat";
        private ConnectionMode connectionMode = ConnectionMode.AUTO;
        private String proxyUrl = "";
        private long pacingDelayMs = 500;
        private int connectTimeoutMs = 10_000;
        private int requestTimeoutMs = 120_000;
        private int maxFiles = 20;
        private int largeFileThreshold = 50_000;

        public Builder providerId(@Nonnull String value) {
            this.providerId = value;
            return this;
        }

        public Builder connectionMode(@Nonnull ConnectionMode value) {
            this.connectionMode = value;
            return this;
        }

        public Builder proxyUrl(String value) {
            this.proxyUrl = value;
            return this;
        }

        public Builder pacingDelayMs(long value) {
            this.pacingDelayMs = value;
            return this;
        }

        public Builder connectTimeoutMs(int value) {
            this.connectTimeoutMs = value;
            return this;
        }

        public Builder requestTimeoutMs(int value) {
            this.requestTimeoutMs = value;
            return this;
        }

        public Builder maxFiles(int value) {
            this.maxFiles = value;
            return this;
        }

        public Builder largeFileThreshold(int value) {
            this.largeFileThreshold = value;
            return this;
        }

        public ReviewSettings build() {
            return new ReviewSettings(this);
        }
    }
}
