package com.teknolojikpanda.codereview.util;

import com.teknolojikpanda.codereview.model.LogLevel;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for emitting structured log lines of the form
 * {@code event=<event> message="..." key=value ...} so review sessions can be traced with grep.
 */
public final class LogSupport {

    private LogSupport() {
    }

    public static void info(Logger logger, String event, @Nullable String message, Object... fields) {
        if (logger.isInfoEnabled()) {
            logger.info(format(event, message, fields));
        }
    }

    public static void debug(Logger logger, String event, @Nullable String message, Object... fields) {
        if (logger.isDebugEnabled()) {
            logger.debug(format(event, message, fields));
        }
    }

    public static void warn(Logger logger, String event, @Nullable String message, Object... fields) {
        if (logger.isWarnEnabled()) {
            logger.warn(format(event, message, fields));
        }
    }

    public static void error(Logger logger, String event, @Nullable String message, Throwable error, Object... fields) {
        logger.error(format(event, message, fields), error);
    }

    /**
     * Mirrors a session {@link LogLevel} onto the matching SLF4J level.
     */
    public static void log(Logger logger, @Nonnull LogLevel level, String event, @Nullable String message, Object... fields) {
        switch (level) {
            case ERROR:
                logger.error(format(event, message, fields));
                break;
            case WARNING:
                warn(logger, event, message, fields);
                break;
            default:
                info(logger, event, message, fields);
                break;
        }
    }

    /**
     * Cuts a value down to {@code maxLength} characters, trimming surrounding whitespace first.
     */
    @Nullable
    public static String abbreviate(@Nullable String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() <= maxLength) {
            return trimmed;
        }
        return trimmed.substring(0, Math.max(0, maxLength));
    }

    static String format(String event, @Nullable String message, Object... fields) {
        Map<String, Object> map = toFieldMap(fields);
        StringBuilder sb = new StringBuilder();
        sb.append("event=").append(event);
        if (message != null && !message.isBlank()) {
            sb.append(' ').append("message=\"").append(safe(message)).append("\"");
        }
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            sb.append(' ').append(entry.getKey()).append('=');
            if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append('"').append(safe(String.valueOf(value))).append('"');
            }
        }
        return sb.toString();
    }

    private static Map<String, Object> toFieldMap(Object... fields) {
        if (fields == null || fields.length == 0) {
            return Collections.emptyMap();
        }
        if ((fields.length & 1) == 1) {
            throw new IllegalArgumentException("Fields must be provided as key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < fields.length; i += 2) {
            Object key = fields[i];
            if (key == null || String.valueOf(key).isBlank()) {
                continue;
            }
            map.put(String.valueOf(key), fields[i + 1]);
        }
        return map;
    }

    private static String safe(String value) {
        return Objects.requireNonNullElse(value, "").replace('\n', ' ').replace('\r', ' ');
    }
}
