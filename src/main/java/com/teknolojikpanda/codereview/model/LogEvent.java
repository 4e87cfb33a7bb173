package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Human readable log line broadcast to session listeners.
 */
public final class LogEvent {

    private final long timestamp;
    private final LogLevel level;
    private final String message;
    private final String detail;

    public LogEvent(@Nonnull LogLevel level, @Nonnull String message, @Nullable String detail) {
        this.timestamp = System.currentTimeMillis();
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.detail = detail;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Nonnull
    public LogLevel getLevel() {
        return level;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Nullable
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "[" + level + "] " + message + (detail != null ? " - " + detail : "");
    }
}
