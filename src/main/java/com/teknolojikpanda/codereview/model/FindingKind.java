package com.teknolojikpanda.codereview.model;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Severity-like kind attached to every finding.
 */
public enum FindingKind {
    ERROR("error"),
    WARNING("warning"),
    INFO("info"),
    STYLE("style");

    private final String wireValue;

    FindingKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    @Nonnull
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolves the kind from its wire value.
     *
     * @return the matching kind, or {@code null} when the value is unknown
     */
    @Nullable
    public static FindingKind fromWireValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ENGLISH);
        for (FindingKind kind : values()) {
            if (kind.wireValue.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
