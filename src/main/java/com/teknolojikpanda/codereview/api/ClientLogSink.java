package com.teknolojikpanda.codereview.api;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Receives request lifecycle phases from an {@link AiReviewClient} call.
 */
@FunctionalInterface
public interface ClientLogSink {

    void log(@Nonnull String phase, @Nullable String detail);
}
