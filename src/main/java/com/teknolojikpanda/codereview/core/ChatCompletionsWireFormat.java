package com.teknolojikpanda.codereview.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.model.WireFormat;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI style {@code /v1/chat/completions} format, also spoken by DeepSeek, Moonshot and Doubao.
 */
final class ChatCompletionsWireFormat implements WireFormatHandler {

    @Nonnull
    @Override
    public WireFormat format() {
        return WireFormat.CHAT_COMPLETIONS;
    }

    @Nonnull
    @Override
    public Map<String, Object> buildBody(@Nonnull ProviderProfile profile, @Nonnull String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", profile.getModel());
        body.put("messages", List.of(
                message("system", PromptRenderer.SYSTEM_PROMPT),
                message("user", prompt)));
        body.put("temperature", 0);
        body.put("max_tokens", WireFormatHandler.completionTokens(profile));
        return body;
    }

    @Nonnull
    @Override
    public Map<String, String> directHeaders(@Nonnull ProviderProfile profile, @Nonnull String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        String headerName = profile.getAuthHeaderName();
        if ("Authorization".equalsIgnoreCase(headerName)) {
            headers.put(headerName, "Bearer " + credential);
        } else {
            headers.put(headerName, credential);
        }
        return headers;
    }

    @Nonnull
    @Override
    public String relayPath() {
        return "/v1/chat/completions";
    }

    @Nonnull
    @Override
    public String extractReply(@Nonnull String responseBody) {
        JsonNode root = LenientJson.readTreeOrNull(responseBody);
        if (root == null) {
            return responseBody;
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isTextual() && !content.asText().isEmpty()) {
            return content.asText();
        }
        JsonNode data = root.path("data");
        if (data.isTextual() && !data.asText().isEmpty()) {
            return data.asText();
        }
        return responseBody;
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
