package com.teknolojikpanda.codereview.api;

import com.teknolojikpanda.codereview.model.FileReview;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Delegates the review of a single file to a remote language model.
 */
public interface AiReviewClient {

    /**
     * Reviews a file without a per-call log sink or cancellation support.
     */
    @Nonnull
    default FileReview review(@Nonnull String path,
                              @Nonnull String content,
                              @Nonnull String language,
                              @Nonnull String complianceText) {
        return review(path, content, language, complianceText, null, CancellationToken.NONE);
    }

    /**
     * Reviews a file and returns the remote findings.
     * <p>
     * Implementations never fail because of provider or transport problems; those are turned into
     * findings. Only cancellation escapes as {@link ReviewCanceledException}.
     *
     * @param path           repository relative path, used for prompts and logs
     * @param content        raw file content
     * @param language       language detected from the file suffix
     * @param complianceText standards the code is reviewed against
     * @param log            optional sink for request lifecycle phases (may be null)
     * @param cancellation   checked before every network dispatch
     */
    @Nonnull
    FileReview review(@Nonnull String path,
                      @Nonnull String content,
                      @Nonnull String language,
                      @Nonnull String complianceText,
                      @Nullable ClientLogSink log,
                      @Nonnull CancellationToken cancellation);
}
