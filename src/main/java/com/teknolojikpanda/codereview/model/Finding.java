package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single issue reported for a file, either by a local heuristic or by the remote model.
 */
public final class Finding {

    private final int line;
    private final Integer column;
    private final FindingKind kind;
    private final FindingCategory category;
    private final String message;
    private final String suggestion;
    private final String sourceLine;
    private final List<String> contextLines;

    private Finding(Builder builder) {
        if (builder.line < 1) {
            throw new IllegalArgumentException("line must be positive: " + builder.line);
        }
        if (builder.column != null && builder.column < 1) {
            throw new IllegalArgumentException("column must be positive: " + builder.column);
        }
        this.line = builder.line;
        this.column = builder.column;
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.category = Objects.requireNonNull(builder.category, "category");
        this.message = Objects.requireNonNull(builder.message, "message");
        this.suggestion = builder.suggestion != null ? builder.suggestion : "";
        this.sourceLine = builder.sourceLine != null ? builder.sourceLine : "";
        this.contextLines = Collections.unmodifiableList(new ArrayList<>(builder.contextLines));
    }

    public int getLine() {
        return line;
    }

    @Nullable
    public Integer getColumn() {
        return column;
    }

    @Nonnull
    public FindingKind getKind() {
        return kind;
    }

    @Nonnull
    public FindingCategory getCategory() {
        return category;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Nonnull
    public String getSuggestion() {
        return suggestion;
    }

    @Nonnull
    public String getSourceLine() {
        return sourceLine;
    }

    @Nonnull
    public List<String> getContextLines() {
        return contextLines;
    }

    @Override
    public String toString() {
        return "Finding{" + kind.getWireValue() + "/" + category.getWireValue()
                + " line=" + line + " message='" + message + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int line = 1;
        private Integer column;
        private FindingKind kind = FindingKind.INFO;
        private FindingCategory category = FindingCategory.MAINTAINABILITY;
        private String message;
        private String suggestion;
        private String sourceLine;
        private List<String> contextLines = new ArrayList<>();

        public Builder line(int value) {
            this.line = value;
            return this;
        }

        public Builder column(@Nullable Integer value) {
            this.column = value;
            return this;
        }

        public Builder kind(@Nonnull FindingKind value) {
            this.kind = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder category(@Nonnull FindingCategory value) {
            this.category = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder message(@Nonnull String value) {
            this.message = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder suggestion(@Nullable String value) {
            this.suggestion = value;
            return this;
        }

        public Builder sourceLine(@Nullable String value) {
            this.sourceLine = value;
            return this;
        }

        public Builder contextLines(@Nonnull List<String> value) {
            this.contextLines = new ArrayList<>(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }
}
