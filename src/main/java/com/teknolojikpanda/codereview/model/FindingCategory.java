package com.teknolojikpanda.codereview.model;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * General buckets for classifying findings.
 */
public enum FindingCategory {
    SECURITY("security"),
    PERFORMANCE("performance"),
    MAINTAINABILITY("maintainability"),
    READABILITY("readability"),
    BEST_PRACTICES("best-practices");

    private final String wireValue;

    FindingCategory(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Nonnull
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolves the category from its wire value.
     *
     * @return the matching category, or {@code null} when the value is unknown
     */
    @Nullable
    public static FindingCategory fromWireValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ENGLISH);
        for (FindingCategory category : values()) {
            if (category.wireValue.equals(normalized)) {
                return category;
            }
        }
        return null;
    }
}
