package com.teknolojikpanda.codereview.api;

import com.teknolojikpanda.codereview.model.LogEvent;
import com.teknolojikpanda.codereview.model.ProgressEvent;

import javax.annotation.Nonnull;

/**
 * Listener notified synchronously while a review session runs. Listeners observe only; the
 * session does not continue until every registered listener has returned.
 */
public interface ReviewEventListener {

    /**
     * Called with the full current progress on every state change.
     */
    default void onProgress(@Nonnull ProgressEvent progress) {
        // no-op
    }

    /**
     * Called for every log line the session emits.
     */
    default void onLog(@Nonnull LogEvent event) {
        // no-op
    }
}
