package com.teknolojikpanda.codereview.progress;

import com.teknolojikpanda.codereview.api.ReviewEventListener;
import com.teknolojikpanda.codereview.model.LogEvent;
import com.teknolojikpanda.codereview.model.LogLevel;
import com.teknolojikpanda.codereview.model.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-session observer registry for progress and log events.
 * <p>
 * Events are delivered synchronously, in registration order, on the publishing thread. Every
 * published event is also kept so late subscribers can replay the session so far. Publishing
 * and replay share one lock, so a late subscriber sees each event exactly once.
 */
public final class ReviewEventBus {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventBus.class);

    private final CopyOnWriteArrayList<ReviewEventListener> listeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ProgressEvent> progressHistory = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<LogEvent> logHistory = new CopyOnWriteArrayList<>();
    private final Object publishLock = new Object();

    public void register(@Nonnull ReviewEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean unregister(@Nonnull ReviewEventListener listener) {
        return listeners.remove(listener);
    }

    public void publishProgress(@Nonnull ProgressEvent progress) {
        Objects.requireNonNull(progress, "progress");
        synchronized (publishLock) {
            progressHistory.add(progress);
            for (ReviewEventListener listener : listeners) {
                deliverProgress(listener, progress);
            }
        }
    }

    @Nonnull
    public LogEvent publishLog(@Nonnull LogLevel level, @Nonnull String message, @Nullable String detail) {
        LogEvent event = new LogEvent(level, message, detail);
        synchronized (publishLock) {
            logHistory.add(event);
            for (ReviewEventListener listener : listeners) {
                deliverLog(listener, event);
            }
        }
        return event;
    }

    /**
     * Progress events published so far, oldest first.
     */
    @Nonnull
    public List<ProgressEvent> progressSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(progressHistory));
    }

    /**
     * Log events published so far, oldest first.
     */
    @Nonnull
    public List<LogEvent> logSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(logHistory));
    }

    /**
     * Delivers the recorded history to a listener, then registers it for live events.
     */
    public void replayAndRegister(@Nonnull ReviewEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (publishLock) {
            for (ProgressEvent progress : progressHistory) {
                deliverProgress(listener, progress);
            }
            for (LogEvent event : logHistory) {
                deliverLog(listener, event);
            }
            listeners.add(listener);
        }
    }

    private static void deliverProgress(ReviewEventListener listener, ProgressEvent progress) {
        try {
            listener.onProgress(progress);
        } catch (Exception ex) {
            log.debug("Progress listener {} failed: {}", listener, ex.getMessage(), ex);
        }
    }

    private static void deliverLog(ReviewEventListener listener, LogEvent event) {
        try {
            listener.onLog(event);
        } catch (Exception ex) {
            log.debug("Log listener {} failed: {}", listener, ex.getMessage(), ex);
        }
    }
}
