package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of reviewing one file. Created once per analyzed file and never changed afterwards.
 */
public final class FileReview {

    private final String path;
    private final List<Finding> findings;
    private final String note;

    public FileReview(@Nonnull String path, @Nonnull List<Finding> findings, @Nonnull String note) {
        this.path = Objects.requireNonNull(path, "path");
        this.findings = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(findings, "findings")));
        this.note = Objects.requireNonNull(note, "note");
    }

    @Nonnull
    public static FileReview failed(@Nonnull String path, @Nonnull String note) {
        return new FileReview(path, Collections.emptyList(), note);
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    @Nonnull
    public List<Finding> getFindings() {
        return findings;
    }

    @Nonnull
    public String getNote() {
        return note;
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
