package com.teknolojikpanda.codereview.util;

import org.slf4j.MDC;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Scopes MDC values for the duration of a review session or of a single file.
 *
 * <p>Every log statement emitted while an instance is open carries the session id, repository
 * and branch, plus a correlation id that survives hops onto background executors when the
 * caller re-opens the context there.</p>
 */
public final class LogContext implements AutoCloseable {

    static final String CORRELATION_KEY = "review.correlationId";
    static final String SESSION_KEY = "session.id";
    static final String FILE_KEY = "review.file";

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previousValues = new LinkedHashMap<>();

    private LogContext(Map<String, String> values) {
        values.forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                return;
            }
            keys.add(key);
            previousValues.put(key, MDC.get(key));
            MDC.put(key, value);
        });
    }

    public static LogContext forSession(String sessionId, @Nullable String repositoryRef, @Nullable String branchRef) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(CORRELATION_KEY, correlationId());
        values.put(SESSION_KEY, trim(sessionId));
        values.put("repository", trim(repositoryRef));
        values.put("branch", trim(branchRef));
        return new LogContext(values);
    }

    public static LogContext forFile(@Nullable String path) {
        if (path == null || path.isBlank()) {
            return new LogContext(Collections.emptyMap());
        }
        return new LogContext(Collections.singletonMap(FILE_KEY, path.trim()));
    }

    public static String correlationId() {
        String current = MDC.get(CORRELATION_KEY);
        if (current != null && !current.isBlank()) {
            return current;
        }
        return UUID.randomUUID().toString();
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String key = keys.get(i);
            String previous = previousValues.get(key);
            if (previous == null || previous.isBlank()) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }

    @Nullable
    private static String trim(@Nullable String input) {
        return input == null ? null : input.trim();
    }
}
