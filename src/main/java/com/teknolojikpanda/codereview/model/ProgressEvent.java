package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Immutable snapshot of a session's progress, broadcast on every state change.
 */
public final class ProgressEvent {

    private final long timestamp;
    private final int totalFiles;
    private final int processedFiles;
    private final String currentFile;
    private final ReviewPhase phase;
    private final String errorMessage;

    private ProgressEvent(Builder builder) {
        this.timestamp = builder.timestamp;
        this.totalFiles = builder.totalFiles;
        this.processedFiles = builder.processedFiles;
        this.currentFile = builder.currentFile;
        this.phase = builder.phase;
        this.errorMessage = builder.errorMessage;
    }

    @Nonnull
    public static ProgressEvent idle() {
        return builder().build();
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getProcessedFiles() {
        return processedFiles;
    }

    @Nonnull
    public String getCurrentFile() {
        return currentFile;
    }

    @Nonnull
    public ReviewPhase getPhase() {
        return phase;
    }

    @Nullable
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Starts a builder pre-populated with this event's values so callers can apply partial updates.
     */
    @Nonnull
    public Builder toBuilder() {
        return new Builder()
                .totalFiles(totalFiles)
                .processedFiles(processedFiles)
                .currentFile(currentFile)
                .phase(phase)
                .errorMessage(errorMessage);
    }

    @Override
    public String toString() {
        return "ProgressEvent{" + phase.getWireValue() + " " + processedFiles + "/" + totalFiles
                + " current='" + currentFile + "'"
                + (errorMessage != null ? " error='" + errorMessage + "'" : "") + "}";
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long timestamp = System.currentTimeMillis();
        private int totalFiles;
        private int processedFiles;
        private String currentFile = "";
        private ReviewPhase phase = ReviewPhase.IDLE;
        private String errorMessage;

        private Builder() {
        }

        @Nonnull
        public Builder timestamp(long value) {
            this.timestamp = value;
            return this;
        }

        @Nonnull
        public Builder totalFiles(int value) {
            this.totalFiles = Math.max(0, value);
            return this;
        }

        @Nonnull
        public Builder processedFiles(int value) {
            this.processedFiles = Math.max(0, value);
            return this;
        }

        @Nonnull
        public Builder currentFile(@Nullable String value) {
            this.currentFile = value != null ? value : "";
            return this;
        }

        @Nonnull
        public Builder phase(@Nonnull ReviewPhase value) {
            this.phase = Objects.requireNonNull(value, "value");
            return this;
        }

        @Nonnull
        public Builder errorMessage(@Nullable String value) {
            this.errorMessage = value;
            return this;
        }

        @Nonnull
        public ProgressEvent build() {
            return new ProgressEvent(this);
        }
    }
}
