package com.teknolojikpanda.codereview.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Request/response shapes spoken by the supported providers.
 */
public enum WireFormat {
    /** {@code choices[0].message.content} style APIs with bearer authentication. */
    CHAT_COMPLETIONS("chat-completions"),
    /** {@code content[0].text} style APIs with a raw key header. */
    MESSAGES("messages");

    private final String wireValue;

    WireFormat(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
