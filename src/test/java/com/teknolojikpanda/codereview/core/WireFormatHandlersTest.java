package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.model.WireFormat;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class WireFormatHandlersTest {

    private static final ProviderProfile CHAT = ProviderProfile.builder()
            .providerId("deepseek-chat")
            .wireFormat(WireFormat.CHAT_COMPLETIONS)
            .endpoint("https://api.deepseek.com/v1/chat/completions")
            .maxTokens(32_768)
            .build();

    private static final ProviderProfile MESSAGES = ProviderProfile.builder()
            .providerId("claude-3-sonnet")
            .model("claude-3-sonnet-20240229")
            .wireFormat(WireFormat.MESSAGES)
            .endpoint("https://api.anthropic.com/v1/messages")
            .authHeaderName("x-api-key")
            .maxTokens(200_000)
            .build();

    @Test
    public void chatBodyCarriesSystemAndUserMessages() {
        WireFormatHandler handler = WireFormatHandlers.forFormat(WireFormat.CHAT_COMPLETIONS);

        Map<String, Object> body = handler.buildBody(CHAT, "review this");

        assertEquals("deepseek-chat", body.get("model"));
        assertEquals(0, body.get("temperature"));
        assertEquals(2048, body.get("max_tokens"));
        List<?> messages = (List<?>) body.get("messages");
        assertEquals(2, messages.size());
        assertEquals("system", ((Map<?, ?>) messages.get(0)).get("role"));
        assertEquals("user", ((Map<?, ?>) messages.get(1)).get("role"));
        assertEquals("review this", ((Map<?, ?>) messages.get(1)).get("content"));
    }

    @Test
    public void completionTokensNeverExceedProfileLimit() {
        ProviderProfile small = ProviderProfile.builder()
                .providerId("tiny")
                .endpoint("https://tiny.example/v1/chat/completions")
                .maxTokens(512)
                .build();

        assertEquals(512, WireFormatHandler.completionTokens(small));
        assertEquals(2048, WireFormatHandler.completionTokens(MESSAGES));
    }

    @Test
    public void chatUsesBearerAuthorization() {
        Map<String, String> headers = WireFormatHandlers.forFormat(WireFormat.CHAT_COMPLETIONS)
                .directHeaders(CHAT, "sk-test");

        assertEquals("Bearer sk-test", headers.get("Authorization"));
        assertEquals("application/json", headers.get("Content-Type"));
    }

    @Test
    public void chatReplyIsReadFromFirstChoice() {
        WireFormatHandler handler = WireFormatHandlers.forFormat(WireFormat.CHAT_COMPLETIONS);

        assertEquals("[]", handler.extractReply("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"[]\"}}]}"));
        assertEquals("relayed", handler.extractReply("{\"data\":\"relayed\"}"));
        assertEquals("{\"id\":\"x\"}", handler.extractReply("{\"id\":\"x\"}"));
        assertEquals("plain text", handler.extractReply("plain text"));
    }

    @Test
    public void messagesFormatSendsRawKeyAndVersion() {
        WireFormatHandler handler = WireFormatHandlers.forFormat(WireFormat.MESSAGES);

        Map<String, String> headers = handler.directHeaders(MESSAGES, "sk-ant");
        Map<String, Object> body = handler.buildBody(MESSAGES, "review this");

        assertEquals("sk-ant", headers.get("x-api-key"));
        assertEquals(MessagesWireFormat.API_VERSION, headers.get("anthropic-version"));
        assertFalse(headers.containsKey("Authorization"));
        assertEquals("claude-3-sonnet-20240229", body.get("model"));
        assertEquals(2048, body.get("max_tokens"));
        assertFalse(body.containsKey("temperature"));
        assertEquals(1, ((List<?>) body.get("messages")).size());
    }

    @Test
    public void messagesReplyIsReadFromFirstContentBlock() {
        WireFormatHandler handler = WireFormatHandlers.forFormat(WireFormat.MESSAGES);

        assertEquals("[{\"line\":1}]",
                handler.extractReply("{\"content\":[{\"type\":\"text\",\"text\":\"[{\\\"line\\\":1}]\"}]}"));
        assertEquals("{\"error\":\"overloaded\"}", handler.extractReply("{\"error\":\"overloaded\"}"));
    }

    @Test
    public void relayPathsFollowTheFormat() {
        assertEquals("/v1/chat/completions", WireFormatHandlers.forFormat(WireFormat.CHAT_COMPLETIONS).relayPath());
        assertEquals("/v1/messages", WireFormatHandlers.forFormat(WireFormat.MESSAGES).relayPath());
        assertTrue(RemoteReviewClient.relayUri("http://relay.local/", WireFormatHandlers.forFormat(WireFormat.MESSAGES))
                .toString().equals("http://relay.local/v1/messages"));
    }
}
