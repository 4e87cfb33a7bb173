package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.model.WireFormat;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Encodes requests and decodes replies for one provider wire format.
 */
public interface WireFormatHandler {

    /** Cap on completion tokens requested from any provider. */
    int MAX_COMPLETION_TOKENS = 2048;

    @Nonnull
    WireFormat format();

    /**
     * Request body sent to the provider, before relay additions.
     */
    @Nonnull
    Map<String, Object> buildBody(@Nonnull ProviderProfile profile, @Nonnull String prompt);

    /**
     * Headers for a direct call, including authentication.
     */
    @Nonnull
    Map<String, String> directHeaders(@Nonnull ProviderProfile profile, @Nonnull String credential);

    /**
     * Path appended to the relay base URL.
     */
    @Nonnull
    String relayPath();

    /**
     * Pulls the model's reply text out of the response envelope. Falls back to the raw body when
     * the expected fields are missing.
     */
    @Nonnull
    String extractReply(@Nonnull String responseBody);

    static int completionTokens(@Nonnull ProviderProfile profile) {
        return Math.min(profile.getMaxTokens(), MAX_COMPLETION_TOKENS);
    }
}
