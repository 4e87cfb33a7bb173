package com.teknolojikpanda.codereview;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.teknolojikpanda.codereview.api.ReviewEventListener;
import com.teknolojikpanda.codereview.core.FindingNormalizer;
import com.teknolojikpanda.codereview.core.HttpModelTransport;
import com.teknolojikpanda.codereview.core.PromptRenderer;
import com.teknolojikpanda.codereview.core.ProviderCatalog;
import com.teknolojikpanda.codereview.core.ProviderRateLimiter;
import com.teknolojikpanda.codereview.core.RemoteReviewClient;
import com.teknolojikpanda.codereview.core.ReviewSessionOrchestrator;
import com.teknolojikpanda.codereview.core.ReviewSettingsFactory;
import com.teknolojikpanda.codereview.core.SecretRedactor;
import com.teknolojikpanda.codereview.model.LogEvent;
import com.teknolojikpanda.codereview.model.ProviderProfile;
import com.teknolojikpanda.codereview.model.ReviewSettings;
import com.teknolojikpanda.codereview.model.SessionResult;
import com.teknolojikpanda.codereview.source.LocalDirectorySourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line entry point. Configured entirely through environment variables; reviews a local
 * working tree and writes the session result to {@code out/review-result.json} and stdout.
 */
public class ReviewApplication {

    private static final Logger log = LoggerFactory.getLogger(ReviewApplication.class);

    public static void main(String[] args) throws Exception {
        String apiKey = reqEnv("REVIEW_API_KEY");
        Path sourceDir = Paths.get(env("REVIEW_SOURCE_DIR", "."));
        String repository = env("REVIEW_REPOSITORY", sourceDir.toAbsolutePath().normalize().toString());
        String branch = env("REVIEW_BRANCH", "main");

        ReviewSettings settings = new ReviewSettingsFactory().from(settingsFromEnv());
        ProviderProfile profile = ProviderCatalog.find(settings.getProviderId())
                .orElseThrow(() -> new IllegalStateException("Unknown provider " + settings.getProviderId()));

        String complianceText = "";
        String standardsFile = System.getenv("REVIEW_STANDARDS_FILE");
        if (standardsFile != null && !standardsFile.isBlank()) {
            complianceText = Files.readString(Paths.get(standardsFile.trim()), StandardCharsets.UTF_8);
        }

        RemoteReviewClient client = new RemoteReviewClient(
                new HttpModelTransport(settings.getConnectTimeoutMs()),
                new ProviderRateLimiter(),
                new SecretRedactor(),
                new PromptRenderer(),
                new FindingNormalizer(),
                Duration.ofMillis(settings.getRequestTimeoutMs()));
        client.configure(apiKey, profile, settings.getConnectionMode(), settings.getProxyUrl());

        ReviewSessionOrchestrator orchestrator = new ReviewSessionOrchestrator(
                new LocalDirectorySourceProvider(sourceDir, settings.getMaxFiles()), client, settings);
        orchestrator.addListener(new ReviewEventListener() {
            @Override
            public void onLog(LogEvent event) {
                System.err.println("[" + event.getLevel() + "] " + event.getMessage()
                        + (event.getDetail() != null ? " - " + event.getDetail() : ""));
            }
        });

        SessionResult result;
        try {
            result = orchestrator.run(repository, branch, complianceText);
        } catch (RuntimeException ex) {
            log.error("Review session failed: {}", ex.getMessage(), ex);
            fail("Review session failed: " + ex.getMessage());
            return;
        }

        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        ObjectWriter pretty = mapper.writerWithDefaultPrettyPrinter();
        String json = pretty.writeValueAsString(result);

        Path outDir = Paths.get("out");
        Files.createDirectories(outDir);
        Files.writeString(outDir.resolve("review-result.json"), json, StandardCharsets.UTF_8);
        System.out.println(json);
    }

    static Map<String, Object> settingsFromEnv() {
        Map<String, Object> config = new LinkedHashMap<>();
        putEnv(config, "provider", "REVIEW_PROVIDER");
        putEnv(config, "connectionMode", "REVIEW_CONNECTION_MODE");
        putEnv(config, "proxyUrl", "REVIEW_PROXY_URL");
        putEnv(config, "pacingDelayMs", "REVIEW_PACING_DELAY_MS");
        putEnv(config, "connectTimeoutMs", "REVIEW_CONNECT_TIMEOUT_MS");
        putEnv(config, "requestTimeoutMs", "REVIEW_REQUEST_TIMEOUT_MS");
        putEnv(config, "maxFiles", "REVIEW_MAX_FILES");
        putEnv(config, "largeFileThreshold", "REVIEW_LARGE_FILE_THRESHOLD");
        return config;
    }

    private static void putEnv(Map<String, Object> config, String key, String variable) {
        String value = System.getenv(variable);
        if (value != null && !value.isBlank()) {
            config.put(key, value.trim());
        }
    }

    private static String env(String key, String def) {
        String v = System.getenv(key);
        return v == null || v.isBlank() ? def : v.trim();
    }

    private static String reqEnv(String key) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) {
            fail("Missing ENV: " + key);
        }
        return v.trim();
    }

    private static void fail(String msg) {
        System.err.println("[ERROR] " + msg);
        System.exit(1);
    }
}
