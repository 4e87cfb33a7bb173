package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated counts over all file reviews of a session.
 */
public final class ReviewSummary {

    private final int totalFiles;
    private final int totalFindings;
    private final int filesWithFindings;
    private final Map<FindingKind, Integer> findingsByKind;
    private final Map<FindingCategory, Integer> findingsByCategory;

    private ReviewSummary(Builder builder) {
        this.totalFiles = builder.totalFiles;
        this.totalFindings = builder.totalFindings;
        this.filesWithFindings = builder.filesWithFindings;
        this.findingsByKind = Collections.unmodifiableMap(new EnumMap<>(builder.findingsByKind));
        this.findingsByCategory = Collections.unmodifiableMap(new EnumMap<>(builder.findingsByCategory));
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getTotalFindings() {
        return totalFindings;
    }

    public int getFilesWithFindings() {
        return filesWithFindings;
    }

    @Nonnull
    public Map<FindingKind, Integer> getFindingsByKind() {
        return findingsByKind;
    }

    @Nonnull
    public Map<FindingCategory, Integer> getFindingsByCategory() {
        return findingsByCategory;
    }

    public int countFor(@Nonnull FindingKind kind) {
        return findingsByKind.getOrDefault(Objects.requireNonNull(kind, "kind"), 0);
    }

    public int countFor(@Nonnull FindingCategory category) {
        return findingsByCategory.getOrDefault(Objects.requireNonNull(category, "category"), 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int totalFiles;
        private int totalFindings;
        private int filesWithFindings;
        private final Map<FindingKind, Integer> findingsByKind = new EnumMap<>(FindingKind.class);
        private final Map<FindingCategory, Integer> findingsByCategory = new EnumMap<>(FindingCategory.class);

        public Builder totalFiles(int value) {
            this.totalFiles = value;
            return this;
        }

        public Builder totalFindings(int value) {
            this.totalFindings = value;
            return this;
        }

        public Builder filesWithFindings(int value) {
            this.filesWithFindings = value;
            return this;
        }

        public Builder addKindCount(@Nonnull FindingKind kind, int count) {
            findingsByKind.merge(Objects.requireNonNull(kind, "kind"), count, Integer::sum);
            return this;
        }

        public Builder addCategoryCount(@Nonnull FindingCategory category, int count) {
            findingsByCategory.merge(Objects.requireNonNull(category, "category"), count, Integer::sum);
            return this;
        }

        public ReviewSummary build() {
            return new ReviewSummary(this);
        }
    }
}
