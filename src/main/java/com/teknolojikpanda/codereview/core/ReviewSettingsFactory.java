package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.ConnectionMode;
import com.teknolojikpanda.codereview.model.ReviewSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.inject.Named;
import java.util.Map;

/**
 * Translates a loosely typed settings map (environment, JSON file) into {@link ReviewSettings}.
 */
@Named
public class ReviewSettingsFactory {

    private static final Logger log = LoggerFactory.getLogger(ReviewSettingsFactory.class);

    @Nonnull
    public ReviewSettings from(@Nonnull Map<String, Object> config) {
        ReviewSettings.Builder builder = ReviewSettings.builder();

        String provider = stringValue(config.get("provider"), ProviderCatalog.DEFAULT_PROVIDER);
        if (ProviderCatalog.find(provider).isEmpty()) {
            log.warn("Unknown provider '{}', falling back to {}", provider, ProviderCatalog.DEFAULT_PROVIDER);
            provider = ProviderCatalog.DEFAULT_PROVIDER;
        }
        builder.providerId(provider);
        builder.connectionMode(ConnectionMode.fromString(stringValue(config.get("connectionMode"), "auto")));
        builder.proxyUrl(stringValue(config.get("proxyUrl"), "").trim());

        builder.pacingDelayMs(intValue(config.get("pacingDelayMs"), 500));
        builder.connectTimeoutMs(intValue(config.get("connectTimeoutMs"), 10_000));
        builder.requestTimeoutMs(intValue(config.get("requestTimeoutMs"), 120_000));
        builder.maxFiles(intValue(config.get("maxFiles"), 20));
        builder.largeFileThreshold(intValue(config.get("largeFileThreshold"), 50_000));

        return builder.build();
    }

    private String stringValue(Object value, String defaultValue) {
        return value instanceof String && !((String) value).isEmpty()
                ? (String) value
                : defaultValue;
    }

    private int intValue(Object value, int defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException ex) {
                log.warn("Ignoring non-numeric setting value '{}', using {}", value, defaultValue);
            }
        }
        return defaultValue;
    }
}
