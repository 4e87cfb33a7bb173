package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.api.ModelTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link ModelTransport} backed by {@link HttpURLConnection}.
 */
public class HttpModelTransport implements ModelTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpModelTransport.class);

    private final int connectTimeoutMs;

    public HttpModelTransport(int connectTimeoutMs) {
        this.connectTimeoutMs = Math.max(1, connectTimeoutMs);
    }

    @Nonnull
    @Override
    public Response post(@Nonnull URI uri,
                         @Nonnull Map<String, String> headers,
                         @Nonnull String body,
                         @Nonnull Duration timeout) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        HttpURLConnection connection = (HttpURLConnection) uri.toURL().openConnection();
        try {
            connection.setRequestMethod("POST");
            headers.forEach(connection::setRequestProperty);
            if (!headers.containsKey("Content-Type")) {
                connection.setRequestProperty("Content-Type", "application/json");
            }
            connection.setRequestProperty("Connection", "close");
            connection.setConnectTimeout(connectTimeoutMs);
            connection.setReadTimeout((int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis())));
            connection.setDoOutput(true);
            connection.setDoInput(true);
            connection.setFixedLengthStreamingMode(payload.length);

            try (OutputStream os = connection.getOutputStream()) {
                os.write(payload);
                os.flush();
            }

            int status = connection.getResponseCode();
            String responseBody = readStream(connection, status >= 400);
            log.debug("POST {} -> {} ({} bytes sent, {} chars received)",
                    uri, status, payload.length, responseBody.length());
            return new Response(status, responseBody);
        } finally {
            connection.disconnect();
        }
    }

    private String readStream(HttpURLConnection connection, boolean error) throws IOException {
        InputStream stream = error ? connection.getErrorStream() : connection.getInputStream();
        if (stream == null) {
            return "";
        }
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
