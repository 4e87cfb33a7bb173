package com.teknolojikpanda.codereview.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a review session.
 */
public enum ReviewPhase {
    IDLE,
    FETCHING,
    ANALYZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
