package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.WireFormat;

import javax.annotation.Nonnull;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Closed registry of wire format handlers.
 */
public final class WireFormatHandlers {

    private static final Map<WireFormat, WireFormatHandler> HANDLERS = new EnumMap<>(WireFormat.class);

    static {
        HANDLERS.put(WireFormat.CHAT_COMPLETIONS, new ChatCompletionsWireFormat());
        HANDLERS.put(WireFormat.MESSAGES, new MessagesWireFormat());
    }

    private WireFormatHandlers() {
    }

    @Nonnull
    public static WireFormatHandler forFormat(@Nonnull WireFormat format) {
        WireFormatHandler handler = HANDLERS.get(Objects.requireNonNull(format, "format"));
        if (handler == null) {
            throw new IllegalArgumentException("No handler for wire format " + format);
        }
        return handler;
    }
}
