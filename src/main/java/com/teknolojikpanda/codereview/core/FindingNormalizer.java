package com.teknolojikpanda.codereview.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.teknolojikpanda.codereview.model.Finding;
import com.teknolojikpanda.codereview.model.FindingCategory;
import com.teknolojikpanda.codereview.model.FindingKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns the free-form text returned by a model into findings.
 * <p>
 * The text between the first {@code [} and the last {@code ]} must be a JSON array of objects.
 * Individual fields are coerced to safe defaults; anything that is not such an array collapses
 * into a single informational finding.
 */
public final class FindingNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FindingNormalizer.class);

    static final String UNSTRUCTURED_MESSAGE = "Model returned unstructured content; the raw text was recorded";
    static final String UNSTRUCTURED_SUGGESTION = "Adjust the prompt so the model returns the JSON structure";
    static final String DEFAULT_MESSAGE = "Issue";

    @Nonnull
    public List<Finding> normalize(@Nullable String replyText, @Nonnull String originalContent) {
        List<Finding> findings = tryParse(replyText);
        if (findings != null) {
            return findings;
        }
        return Collections.singletonList(unstructured(originalContent));
    }

    @Nullable
    private List<Finding> tryParse(@Nullable String replyText) {
        if (replyText == null) {
            return null;
        }
        String trimmed = replyText.trim();
        int start = trimmed.indexOf('[');
        int end = trimmed.lastIndexOf(']');
        if (start < 0 || end <= start) {
            return null;
        }
        JsonNode array = LenientJson.readTreeOrNull(trimmed.substring(start, end + 1));
        if (array == null || !array.isArray()) {
            return null;
        }
        List<Finding> findings = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            if (!node.isObject()) {
                log.debug("Model reply contains a non-object element: {}", node.getNodeType());
                return null;
            }
            findings.add(toFinding(node));
        }
        return findings;
    }

    private Finding toFinding(JsonNode node) {
        FindingKind kind = FindingKind.fromWireValue(text(node, "type", text(node, "kind", null)));
        FindingCategory category = FindingCategory.fromWireValue(text(node, "category", null));
        String message = text(node, "message", null);
        return Finding.builder()
                .line(positive(node.get("line"), 1))
                .column(positiveOrNull(node.get("column")))
                .kind(kind != null ? kind : FindingKind.INFO)
                .category(category != null ? category : FindingCategory.MAINTAINABILITY)
                .message(message != null && !message.isEmpty() ? message : DEFAULT_MESSAGE)
                .suggestion(text(node, "suggestion", ""))
                .sourceLine(text(node, "code", text(node, "sourceLine", "")))
                .contextLines(context(node.get("context")))
                .build();
    }

    static Finding unstructured(@Nonnull String originalContent) {
        return Finding.builder()
                .line(1)
                .kind(FindingKind.INFO)
                .category(FindingCategory.READABILITY)
                .message(UNSTRUCTURED_MESSAGE)
                .suggestion(UNSTRUCTURED_SUGGESTION)
                .sourceLine(SourceLines.firstLine(originalContent))
                .contextLines(SourceLines.head(originalContent, 3))
                .build();
    }

    @Nullable
    private static String text(JsonNode node, String field, @Nullable String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return defaultValue;
        }
        return value.asText();
    }

    private static int positive(@Nullable JsonNode value, int defaultValue) {
        Integer parsed = positiveOrNull(value);
        return parsed != null ? parsed : defaultValue;
    }

    @Nullable
    private static Integer positiveOrNull(@Nullable JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            int number = value.asInt();
            return number >= 1 ? number : null;
        }
        if (value.isTextual()) {
            try {
                int number = (int) Double.parseDouble(value.asText().trim());
                return number >= 1 ? number : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> context(@Nullable JsonNode value) {
        if (value == null || !value.isArray()) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>(value.size());
        for (JsonNode line : value) {
            lines.add(line.isValueNode() ? line.asText() : line.toString());
        }
        return lines;
    }
}
