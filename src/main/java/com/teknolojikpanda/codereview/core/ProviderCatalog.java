package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.model.WireFormat;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Built-in provider profiles.
 */
public final class ProviderCatalog {

    public static final String DEFAULT_PROVIDER = "deepseek-chat";

    private static final List<ProviderProfile> PROFILES = List.of(
            ProviderProfile.builder()
                    .providerId("deepseek-chat")
                    .displayName("DeepSeek Chat")
                    .vendor("DeepSeek")
                    .description("General purpose model with strong code understanding")
                    .wireFormat(WireFormat.CHAT_COMPLETIONS)
                    .endpoint("https://api.deepseek.com/v1/chat/completions")
                    .maxTokens(32_768)
                    .build(),
            ProviderProfile.builder()
                    .providerId("gpt-4")
                    .displayName("GPT-4")
                    .vendor("OpenAI")
                    .description("Strong reasoning across languages")
                    .wireFormat(WireFormat.CHAT_COMPLETIONS)
                    .endpoint("https://api.openai.com/v1/chat/completions")
                    .maxTokens(8_192)
                    .build(),
            ProviderProfile.builder()
                    .providerId("claude-3-sonnet")
                    .displayName("Claude 3 Sonnet")
                    .vendor("Anthropic")
                    .description("Long context window for large files")
                    .model("claude-3-sonnet-20240229")
                    .wireFormat(WireFormat.MESSAGES)
                    .endpoint("https://api.anthropic.com/v1/messages")
                    .authHeaderName("x-api-key")
                    .maxTokens(200_000)
                    .build(),
            ProviderProfile.builder()
                    .providerId("kimi-k2")
                    .displayName("Kimi K2")
                    .vendor("Moonshot")
                    .description("Long context model with mirrored regional endpoints")
                    .wireFormat(WireFormat.CHAT_COMPLETIONS)
                    .endpoint("https://api.moonshot.cn/v1/chat/completions")
                    .endpoint("https://api.moonshot.ai/v1/chat/completions")
                    .maxTokens(200_000)
                    .build(),
            ProviderProfile.builder()
                    .providerId("doubao-pro")
                    .displayName("Doubao Pro")
                    .vendor("ByteDance")
                    .description("Chat model tuned for Chinese and English code bases")
                    .wireFormat(WireFormat.CHAT_COMPLETIONS)
                    .endpoint("https://api.doubao.com/v1/chat/completions")
                    .maxTokens(32_768)
                    .build());

    private ProviderCatalog() {
    }

    @Nonnull
    public static List<ProviderProfile> availableProviders() {
        return PROFILES;
    }

    @Nonnull
    public static Optional<ProviderProfile> find(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        String normalized = providerId.trim();
        return PROFILES.stream()
                .filter(profile -> profile.getProviderId().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
