package com.teknolojikpanda.codereview.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.model.WireFormat;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic style {@code /v1/messages} format.
 */
final class MessagesWireFormat implements WireFormatHandler {

    static final String API_VERSION = "2023-06-01";

    @Nonnull
    @Override
    public WireFormat format() {
        return WireFormat.MESSAGES;
    }

    @Nonnull
    @Override
    public Map<String, Object> buildBody(@Nonnull ProviderProfile profile, @Nonnull String prompt) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("role", "user");
        user.put("content", prompt);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", profile.getModel());
        body.put("max_tokens", WireFormatHandler.completionTokens(profile));
        body.put("messages", List.of(user));
        return body;
    }

    @Nonnull
    @Override
    public Map<String, String> directHeaders(@Nonnull ProviderProfile profile, @Nonnull String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put(profile.getAuthHeaderName(), credential);
        headers.put("anthropic-version", API_VERSION);
        return headers;
    }

    @Nonnull
    @Override
    public String relayPath() {
        return "/v1/messages";
    }

    @Nonnull
    @Override
    public String extractReply(@Nonnull String responseBody) {
        JsonNode root = LenientJson.readTreeOrNull(responseBody);
        if (root == null) {
            return responseBody;
        }
        JsonNode text = root.path("content").path(0).path("text");
        if (text.isTextual() && !text.asText().isEmpty()) {
            return text.asText();
        }
        return responseBody;
    }
}
