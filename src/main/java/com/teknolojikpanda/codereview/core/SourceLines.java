package com.teknolojikpanda.codereview.core;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Line helpers shared by the heuristics and the remote client.
 */
final class SourceLines {

    static final int CONTEXT_RADIUS = 2;

    private SourceLines() {
    }

    /**
     * Splits content into physical lines. A trailing newline yields a final empty line and
     * carriage returns of CRLF files are dropped.
     */
    @Nonnull
    static List<String> split(@Nonnull String content) {
        String[] raw = content.split("\n", -1);
        List<String> lines = new ArrayList<>(raw.length);
        for (String line : raw) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }

    /**
     * Returns the lines within {@link #CONTEXT_RADIUS} of {@code index}, clipped to bounds.
     */
    @Nonnull
    static List<String> window(@Nonnull List<String> lines, int index) {
        int start = Math.max(0, index - CONTEXT_RADIUS);
        int end = Math.min(lines.size(), index + CONTEXT_RADIUS + 1);
        if (start >= end) {
            return new ArrayList<>();
        }
        return new ArrayList<>(lines.subList(start, end));
    }

    @Nonnull
    static String firstLine(@Nonnull String content) {
        List<String> lines = split(content);
        return lines.isEmpty() ? "" : lines.get(0);
    }

    @Nonnull
    static List<String> head(@Nonnull String content, int count) {
        List<String> lines = split(content);
        return new ArrayList<>(lines.subList(0, Math.min(count, lines.size())));
    }
}
