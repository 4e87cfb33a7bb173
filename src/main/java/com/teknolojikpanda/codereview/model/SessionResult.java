package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Final, immutable outcome of a completed review session.
 */
public final class SessionResult {

    private final String sessionId;
    private final String repositoryRef;
    private final String branchRef;
    private final String complianceText;
    private final List<FileReview> reviews;
    private final ReviewSummary summary;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final long elapsedMs;

    private SessionResult(Builder builder) {
        this.sessionId = Objects.requireNonNull(builder.sessionId, "sessionId");
        this.repositoryRef = Objects.requireNonNull(builder.repositoryRef, "repositoryRef");
        this.branchRef = Objects.requireNonNull(builder.branchRef, "branchRef");
        this.complianceText = builder.complianceText != null ? builder.complianceText : "";
        this.reviews = Collections.unmodifiableList(new ArrayList<>(builder.reviews));
        this.summary = Objects.requireNonNull(builder.summary, "summary");
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt");
        this.finishedAt = Objects.requireNonNull(builder.finishedAt, "finishedAt");
        this.elapsedMs = builder.elapsedMs;
    }

    @Nonnull
    public String getSessionId() {
        return sessionId;
    }

    @Nonnull
    public String getRepositoryRef() {
        return repositoryRef;
    }

    @Nonnull
    public String getBranchRef() {
        return branchRef;
    }

    @Nonnull
    public String getComplianceText() {
        return complianceText;
    }

    @Nonnull
    public List<FileReview> getReviews() {
        return reviews;
    }

    @Nonnull
    public ReviewSummary getSummary() {
        return summary;
    }

    @Nonnull
    public Instant getStartedAt() {
        return startedAt;
    }

    @Nonnull
    public Instant getFinishedAt() {
        return finishedAt;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String sessionId;
        private String repositoryRef;
        private String branchRef;
        private String complianceText;
        private List<FileReview> reviews = new ArrayList<>();
        private ReviewSummary summary;
        private Instant startedAt;
        private Instant finishedAt;
        private long elapsedMs;

        public Builder sessionId(@Nonnull String value) {
            this.sessionId = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder repositoryRef(@Nonnull String value) {
            this.repositoryRef = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder branchRef(@Nonnull String value) {
            this.branchRef = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder complianceText(String value) {
            this.complianceText = value;
            return this;
        }

        public Builder reviews(@Nonnull List<FileReview> value) {
            this.reviews = new ArrayList<>(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder summary(@Nonnull ReviewSummary value) {
            this.summary = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder startedAt(@Nonnull Instant value) {
            this.startedAt = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder finishedAt(@Nonnull Instant value) {
            this.finishedAt = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder elapsedMs(long value) {
            this.elapsedMs = value;
            return this;
        }

        public SessionResult build() {
            return new SessionResult(this);
        }
    }
}
