package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.api.AiReviewClient;
import com.teknolojikpanda.codereview.api.CancellationToken;
import com.teknolojikpanda.codereview.api.ClientLogSink;
import com.teknolojikpanda.codereview.api.ModelTransport;
import com.teknolojikpanda.codereview.api.ReviewCanceledException;
import com.teknolojikpanda.codereview.model.ClientStatistics;
import com.teknolojikpanda.codereview.model.ConnectionMode;
import com.teknolojikpanda.codereview.model.FileReview;
import com.teknolojikpanda.codereview.model.Finding;
import com.teknolojikpanda.codereview.model.FindingCategory;
import com.teknolojikpanda.codereview.model.FindingKind;
import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Named;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link AiReviewClient} that talks to one configured remote provider, either directly or through
 * a relay.
 * <p>
 * Each review redacts secrets, renders a bounded prompt, waits for the provider's rate-limit slot
 * and dispatches according to the {@link ConnectionMode}. Provider and configuration problems are
 * reported as a single error finding and counted; only cancellation escapes.
 */
@Named
public class RemoteReviewClient implements AiReviewClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteReviewClient.class);

    static final int RESPONSE_PREVIEW_CHARS = 1_000;
    static final String FAILURE_MESSAGE = "Delegated analysis failed; only heuristic findings are available";
    static final String FAILURE_SUGGESTION = "Check the API key, network access or relay configuration, or retry later";

    private final ModelTransport transport;
    private final ProviderRateLimiter rateLimiter;
    private final SecretRedactor redactor;
    private final PromptRenderer promptRenderer;
    private final FindingNormalizer normalizer;
    private final Duration requestTimeout;

    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    private volatile Connection connection = Connection.EMPTY;

    @Inject
    public RemoteReviewClient(@Nonnull ModelTransport transport) {
        this(transport, new ProviderRateLimiter(), new SecretRedactor(), new PromptRenderer(),
                new FindingNormalizer(), Duration.ofMinutes(2));
    }

    public RemoteReviewClient(@Nonnull ModelTransport transport,
                              @Nonnull ProviderRateLimiter rateLimiter,
                              @Nonnull SecretRedactor redactor,
                              @Nonnull PromptRenderer promptRenderer,
                              @Nonnull FindingNormalizer normalizer,
                              @Nonnull Duration requestTimeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        this.promptRenderer = Objects.requireNonNull(promptRenderer, "promptRenderer");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * Replaces the client configuration. Performs no network access.
     */
    public void configure(@Nullable String credential,
                          @Nullable ProviderProfile profile,
                          @Nullable ConnectionMode mode,
                          @Nullable String proxyEndpoint) {
        this.connection = new Connection(
                credential != null ? credential.trim() : null,
                profile,
                mode != null ? mode : ConnectionMode.AUTO,
                proxyEndpoint != null ? proxyEndpoint.trim() : "");
        LogSupport.info(log, "client.configured", null,
                "provider", profile != null ? profile.getProviderId() : null,
                "mode", this.connection.mode.name().toLowerCase(),
                "relay", !this.connection.proxyEndpoint.isEmpty());
    }

    @Nullable
    public ProviderProfile getProfile() {
        return connection.profile;
    }

    /**
     * Sends a tiny request to the configured provider once its rate-limit slot is free.
     *
     * @return {@code true} when the provider (or relay) answered with a 2xx status
     */
    public boolean testConnection() {
        Connection current = connection;
        try {
            current.validate();
            WireFormatHandler handler = WireFormatHandlers.forFormat(current.profile.getWireFormat());
            Map<String, Object> body = handler.buildBody(current.profile, "ping");
            rateLimiter.acquire(current.profile.getProviderId(), current.profile.getMinRequestIntervalMs());
            if (current.mode == ConnectionMode.PROXY) {
                return sendRelay(current, handler, body, null, CancellationToken.NONE, "connection-test") != null;
            }
            try {
                return sendDirect(current, handler, body, null, CancellationToken.NONE, "connection-test") != null;
            } catch (IOException | RuntimeException ex) {
                if (current.mode == ConnectionMode.AUTO && !current.proxyEndpoint.isEmpty()) {
                    return sendRelay(current, handler, body, null, CancellationToken.NONE, "connection-test") != null;
                }
                throw ex;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LogSupport.warn(log, "client.connection.test.interrupted", "Interrupted while waiting for the provider rate limit");
            return false;
        } catch (Exception ex) {
            LogSupport.warn(log, "client.connection.test.failed", ex.getMessage());
            return false;
        }
    }

    @Nonnull
    @Override
    public FileReview review(@Nonnull String path,
                             @Nonnull String content,
                             @Nonnull String language,
                             @Nonnull String complianceText,
                             @Nullable ClientLogSink sink,
                             @Nonnull CancellationToken cancellation) {
        Connection current = connection;
        try {
            current.validate();
            ProviderProfile profile = current.profile;

            String redacted = redactor.redact(content);
            String prompt = promptRenderer.render(path, redacted, language, complianceText);
            WireFormatHandler handler = WireFormatHandlers.forFormat(profile.getWireFormat());
            Map<String, Object> body = handler.buildBody(profile, prompt);
            emit(sink, "request-build", profile.getDisplayName() + " · review against the supplied standards");
            emit(sink, "parameters", LenientJson.write(parameterPreview(profile)));

            cancellation.throwIfCancellationRequested(path);
            rateLimiter.acquire(profile.getProviderId(), profile.getMinRequestIntervalMs());
            emit(sink, "rate-limit", "total requests: " + rateLimiter.requestCount(profile.getProviderId()));

            long started = System.nanoTime();
            String responseBody = dispatch(current, handler, body, sink, cancellation, path);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            String reply = handler.extractReply(responseBody);
            emit(sink, "response-received", "took " + durationMs + "ms");
            emit(sink, "response-preview", LogSupport.abbreviate(reply, RESPONSE_PREVIEW_CHARS));

            List<Finding> findings = normalizer.normalize(reply, content);
            successCount.incrementAndGet();
            String note = "Review complete, " + findings.size() + " issue(s) found";
            emit(sink, "result", note);
            LogSupport.info(log, "client.review.completed", null,
                    "path", path,
                    "provider", profile.getProviderId(),
                    "findings", findings.size(),
                    "durationMs", durationMs);
            return new FileReview(path, findings, note);
        } catch (ReviewCanceledException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReviewCanceledException(path, "Interrupted while waiting for the provider rate limit.");
        } catch (IOException | RuntimeException ex) {
            return failed(path, content, ex, sink);
        }
    }

    @Nonnull
    public ClientStatistics statistics() {
        return new ClientStatistics(successCount.get(), failureCount.get(), lastError.get());
    }

    public int requestCount(@Nonnull String providerId) {
        return rateLimiter.requestCount(providerId);
    }

    private String dispatch(Connection current,
                            WireFormatHandler handler,
                            Map<String, Object> body,
                            @Nullable ClientLogSink sink,
                            CancellationToken cancellation,
                            String path) throws IOException {
        switch (current.mode) {
            case DIRECT:
                return sendDirect(current, handler, body, sink, cancellation, path);
            case PROXY:
                return sendRelay(current, handler, body, sink, cancellation, path);
            default:
                try {
                    return sendDirect(current, handler, body, sink, cancellation, path);
                } catch (ReviewCanceledException ex) {
                    throw ex;
                } catch (IOException | RuntimeException ex) {
                    if (current.proxyEndpoint.isEmpty()) {
                        throw ex;
                    }
                    emit(sink, "relay-fallback", ex.getMessage());
                    LogSupport.warn(log, "client.relay.fallback", ex.getMessage(), "path", path);
                    return sendRelay(current, handler, body, sink, cancellation, path);
                }
        }
    }

    private String sendDirect(Connection current,
                              WireFormatHandler handler,
                              Map<String, Object> body,
                              @Nullable ClientLogSink sink,
                              CancellationToken cancellation,
                              String path) throws IOException {
        Map<String, String> headers = handler.directHeaders(current.profile, current.credential);
        String payload = LenientJson.write(body);
        Exception lastFailure = null;
        for (URI endpoint : current.profile.getEndpointCandidates()) {
            cancellation.throwIfCancellationRequested(path);
            emit(sink, "request-sent", endpoint.toString());
            try {
                ModelTransport.Response response = transport.post(endpoint, headers, payload, requestTimeout);
                if (response.isSuccess()) {
                    return response.getBody();
                }
                lastFailure = new ProviderHttpException(endpoint, response.getStatusCode(), response.getBody());
            } catch (ReviewCanceledException ex) {
                throw ex;
            } catch (IOException | RuntimeException ex) {
                lastFailure = ex;
            }
            emit(sink, "request-failed", lastFailure.getMessage());
            LogSupport.debug(log, "client.endpoint.failed", lastFailure.getMessage(),
                    "endpoint", endpoint.toString(), "path", path);
        }
        if (lastFailure instanceof IOException) {
            throw (IOException) lastFailure;
        }
        if (lastFailure instanceof RuntimeException) {
            throw (RuntimeException) lastFailure;
        }
        throw new ReviewClientConfigurationException("Provider " + current.profile.getProviderId()
                + " has no endpoint candidates");
    }

    private String sendRelay(Connection current,
                             WireFormatHandler handler,
                             Map<String, Object> body,
                             @Nullable ClientLogSink sink,
                             CancellationToken cancellation,
                             String path) throws IOException {
        if (current.proxyEndpoint.isEmpty()) {
            throw new ReviewClientConfigurationException("Relay URL is not configured");
        }
        URI relay = relayUri(current.proxyEndpoint, handler);
        Map<String, Object> relayBody = new LinkedHashMap<>(body);
        relayBody.put("api_key", current.credential);

        cancellation.throwIfCancellationRequested(path);
        emit(sink, "relay-request-sent", relay.toString());
        ModelTransport.Response response = transport.post(relay,
                Collections.singletonMap("Content-Type", "application/json"),
                LenientJson.write(relayBody),
                requestTimeout);
        if (!response.isSuccess()) {
            throw new ProviderHttpException(relay, response.getStatusCode(), response.getBody());
        }
        return response.getBody();
    }

    static URI relayUri(String proxyEndpoint, WireFormatHandler handler) {
        String base = proxyEndpoint.endsWith("/")
                ? proxyEndpoint.substring(0, proxyEndpoint.length() - 1)
                : proxyEndpoint;
        return URI.create(base + handler.relayPath());
    }

    private FileReview failed(String path, String content, Exception ex, @Nullable ClientLogSink sink) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        failureCount.incrementAndGet();
        lastError.set(message);
        emit(sink, "request-failed", message);
        LogSupport.warn(log, "client.review.failed", message, "path", path);

        Finding failure = Finding.builder()
                .line(1)
                .kind(FindingKind.ERROR)
                .category(FindingCategory.MAINTAINABILITY)
                .message(FAILURE_MESSAGE)
                .suggestion(FAILURE_SUGGESTION)
                .sourceLine(SourceLines.firstLine(content))
                .contextLines(SourceLines.head(content, 3))
                .build();
        return new FileReview(path, Collections.singletonList(failure), "Delegated analysis failed: " + message);
    }

    private static Map<String, Object> parameterPreview(ProviderProfile profile) {
        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("model", profile.getModel());
        preview.put("max_tokens", WireFormatHandler.completionTokens(profile));
        return preview;
    }

    private static void emit(@Nullable ClientLogSink sink, String phase, @Nullable String detail) {
        if (sink == null) {
            return;
        }
        try {
            sink.log(phase, detail);
        } catch (RuntimeException ex) {
            log.debug("Client log sink failed for phase {}: {}", phase, ex.getMessage());
        }
    }

    private static final class Connection {
        private static final Connection EMPTY = new Connection(null, null, ConnectionMode.AUTO, "");

        private final String credential;
        private final ProviderProfile profile;
        private final ConnectionMode mode;
        private final String proxyEndpoint;

        private Connection(@Nullable String credential,
                           @Nullable ProviderProfile profile,
                           ConnectionMode mode,
                           String proxyEndpoint) {
            this.credential = credential;
            this.profile = profile;
            this.mode = mode;
            this.proxyEndpoint = proxyEndpoint;
        }

        private void validate() {
            if (credential == null || credential.isEmpty()) {
                throw new ReviewClientConfigurationException("No API credential configured");
            }
            if (profile == null) {
                throw new ReviewClientConfigurationException("No provider profile configured");
            }
        }
    }
}
