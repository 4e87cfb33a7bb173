package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.Finding;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * A single static check. Line rules look at one physical line at a time, file rules at the
 * whole content; both are independent of each other and of rule order.
 */
public interface HeuristicRule {

    @Nonnull
    String id();

    /**
     * Inspects one line.
     *
     * @param lines all physical lines of the file
     * @param index zero-based index of the line under test
     */
    @Nonnull
    default Optional<Finding> checkLine(@Nonnull List<String> lines, int index) {
        return Optional.empty();
    }

    /**
     * Inspects the whole file once.
     */
    @Nonnull
    default Optional<Finding> checkFile(@Nonnull String content, @Nonnull List<String> lines) {
        return Optional.empty();
    }
}
