package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * How requests reach the provider.
 */
public enum ConnectionMode {
    DIRECT,
    PROXY,
    AUTO;

    @Nonnull
    public static ConnectionMode fromString(@Nullable String value) {
        if (value == null) {
            return AUTO;
        }
        switch (value.trim().toLowerCase(Locale.ENGLISH)) {
            case "direct":
                return DIRECT;
            case "proxy":
            case "relay":
                return PROXY;
            default:
                return AUTO;
        }
    }
}
