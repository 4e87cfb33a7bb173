package com.teknolojikpanda.codereview.model;

import javax.annotation.Nonnull;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static description of a remote analysis provider. Read-only while a session runs.
 */
public final class ProviderProfile {

    private final String providerId;
    private final String displayName;
    private final String vendor;
    private final String description;
    private final String model;
    private final WireFormat wireFormat;
    private final List<URI> endpointCandidates;
    private final String authHeaderName;
    private final long minRequestIntervalMs;
    private final int maxTokens;

    private ProviderProfile(Builder builder) {
        this.providerId = Objects.requireNonNull(builder.providerId, "providerId");
        this.displayName = builder.displayName != null ? builder.displayName : builder.providerId;
        this.vendor = builder.vendor != null ? builder.vendor : "";
        this.description = builder.description != null ? builder.description : "";
        this.model = builder.model != null ? builder.model : builder.providerId;
        this.wireFormat = Objects.requireNonNull(builder.wireFormat, "wireFormat");
        if (builder.endpointCandidates.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint candidate is required for " + providerId);
        }
        this.endpointCandidates = Collections.unmodifiableList(new ArrayList<>(builder.endpointCandidates));
        this.authHeaderName = Objects.requireNonNull(builder.authHeaderName, "authHeaderName");
        this.minRequestIntervalMs = Math.max(0L, builder.minRequestIntervalMs);
        this.maxTokens = builder.maxTokens;
    }

    @Nonnull
    public String getProviderId() {
        return providerId;
    }

    @Nonnull
    public String getDisplayName() {
        return displayName;
    }

    @Nonnull
    public String getVendor() {
        return vendor;
    }

    @Nonnull
    public String getDescription() {
        return description;
    }

    @Nonnull
    public String getModel() {
        return model;
    }

    @Nonnull
    public WireFormat getWireFormat() {
        return wireFormat;
    }

    @Nonnull
    public List<URI> getEndpointCandidates() {
        return endpointCandidates;
    }

    @Nonnull
    public String getAuthHeaderName() {
        return authHeaderName;
    }

    public long getMinRequestIntervalMs() {
        return minRequestIntervalMs;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String providerId;
        private String displayName;
        private String vendor;
        private String description;
        private String model;
        private WireFormat wireFormat = WireFormat.CHAT_COMPLETIONS;
        private final List<URI> endpointCandidates = new ArrayList<>();
        private String authHeaderName = "Authorization";
        private long minRequestIntervalMs = 1000L;
        private int maxTokens = 4096;

        public Builder providerId(@Nonnull String value) {
            this.providerId = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder displayName(String value) {
            this.displayName = value;
            return this;
        }

        public Builder vendor(String value) {
            this.vendor = value;
            return this;
        }

        public Builder description(String value) {
            this.description = value;
            return this;
        }

        public Builder model(String value) {
            this.model = value;
            return this;
        }

        public Builder wireFormat(@Nonnull WireFormat value) {
            this.wireFormat = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder endpoint(@Nonnull String value) {
            this.endpointCandidates.add(URI.create(Objects.requireNonNull(value, "value")));
            return this;
        }

        public Builder endpoints(@Nonnull List<URI> value) {
            this.endpointCandidates.clear();
            this.endpointCandidates.addAll(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder authHeaderName(@Nonnull String value) {
            this.authHeaderName = Objects.requireNonNull(value, "value");
            return this;
        }

        public Builder minRequestIntervalMs(long value) {
            this.minRequestIntervalMs = value;
            return this;
        }

        public Builder maxTokens(int value) {
            this.maxTokens = value;
            return this;
        }

        public ProviderProfile build() {
            return new ProviderProfile(this);
        }
    }
}
