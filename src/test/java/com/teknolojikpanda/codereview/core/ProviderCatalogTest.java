package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.model.WireFormat;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class ProviderCatalogTest {

    @Test
    public void listsAllBuiltInProviders() {
        List<String> ids = ProviderCatalog.availableProviders().stream()
                .map(ProviderProfile::getProviderId)
                .collect(Collectors.toList());

        assertThat(ids, containsInAnyOrder("deepseek-chat", "gpt-4", "claude-3-sonnet", "kimi-k2", "doubao-pro"));
        for (ProviderProfile profile : ProviderCatalog.availableProviders()) {
            assertEquals(1000L, profile.getMinRequestIntervalMs());
        }
    }

    @Test
    public void anthropicProfileUsesMessagesFormat() {
        ProviderProfile claude = ProviderCatalog.find("claude-3-sonnet").orElseThrow();

        assertEquals(WireFormat.MESSAGES, claude.getWireFormat());
        assertEquals("x-api-key", claude.getAuthHeaderName());
    }

    @Test
    public void moonshotProfileHasMirrorEndpoint() {
        ProviderProfile kimi = ProviderCatalog.find(" KIMI-K2 ").orElseThrow();

        assertEquals(2, kimi.getEndpointCandidates().size());
        assertEquals("https://api.moonshot.cn/v1/chat/completions", kimi.getEndpointCandidates().get(0).toString());
    }

    @Test
    public void unknownProviderIsAbsent() {
        assertFalse(ProviderCatalog.find("llama").isPresent());
        assertFalse(ProviderCatalog.find(null).isPresent());
    }
}
