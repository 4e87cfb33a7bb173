package com.teknolojikpanda.codereview.api;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Posts JSON payloads to provider or relay endpoints.
 */
public interface ModelTransport {

    /**
     * Sends a POST request. Non-success status codes are returned, not thrown.
     *
     * @throws IOException on connection problems or timeouts
     */
    @Nonnull
    Response post(@Nonnull URI uri,
                  @Nonnull Map<String, String> headers,
                  @Nonnull String body,
                  @Nonnull Duration timeout) throws IOException;

    final class Response {
        private final int statusCode;
        private final String body;

        public Response(int statusCode, String body) {
            this.statusCode = statusCode;
            this.body = body != null ? body : "";
        }

        public int getStatusCode() {
            return statusCode;
        }

        @Nonnull
        public String getBody() {
            return body;
        }

        public boolean isSuccess() {
            return statusCode / 100 == 2;
        }
    }
}
