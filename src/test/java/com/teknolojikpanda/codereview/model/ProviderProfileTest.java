package com.teknolojikpanda.codereview.model;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ProviderProfileTest {

    @Test
    public void appliesDefaults() {
        ProviderProfile profile = ProviderProfile.builder()
                .providerId("local")
                .endpoint("http://localhost:8080/v1/chat/completions")
                .build();

        assertEquals("local", profile.getModel());
        assertEquals("local", profile.getDisplayName());
        assertEquals("Authorization", profile.getAuthHeaderName());
        assertEquals(1000L, profile.getMinRequestIntervalMs());
        assertEquals(4096, profile.getMaxTokens());
        assertEquals(WireFormat.CHAT_COMPLETIONS, profile.getWireFormat());
    }

    @Test
    public void keepsEndpointOrder() {
        ProviderProfile profile = ProviderProfile.builder()
                .providerId("kimi")
                .endpoint("https://api.moonshot.cn/v1/chat/completions")
                .endpoint("https://api.moonshot.ai/v1/chat/completions")
                .build();

        assertEquals("api.moonshot.cn", profile.getEndpointCandidates().get(0).getHost());
        assertEquals("api.moonshot.ai", profile.getEndpointCandidates().get(1).getHost());
    }

    @Test(expected = IllegalArgumentException.class)
    public void requiresAnEndpoint() {
        ProviderProfile.builder().providerId("empty").build();
    }
}
