package com.teknolojikpanda.codereview.core;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders the bounded review prompt sent to the remote model.
 */
public final class PromptRenderer {

    static final int MAX_COMPLIANCE_CHARS = 8_000;
    static final int MAX_CODE_CHARS = 15_000;

    public static final String SYSTEM_PROMPT = "You are a senior code review expert.";

    public static final String DEFAULT_TEMPLATE =
            "You are a code review expert. Review the code strictly against the development standards below "
                    + "and reply with JSON only.\n"
                    + "File: {{FILE_PATH}}\n"
                    + "Language: {{LANGUAGE}}\n"
                    + "Return a JSON array where each element is one issue: "
                    + "{ line, column, type, category, message, suggestion, code, context }.\n"
                    + "type is one of error, warning, info, style. "
                    + "category is one of security, performance, maintainability, readability, best-practices. "
                    + "context is an array of the surrounding source lines. Return only the JSON array.\n"
                    + "Standards:\n{{STANDARDS}}\n"
                    + "---\n"
                    + "Code:\n{{CODE}}";

    private final String template;

    public PromptRenderer() {
        this(DEFAULT_TEMPLATE);
    }

    public PromptRenderer(@Nonnull String template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    /**
     * Renders the user prompt. Compliance text and code are cut to their limits; the file path and
     * language are passed through unchanged.
     */
    @Nonnull
    public String render(@Nonnull String path,
                         @Nonnull String redactedCode,
                         @Nonnull String language,
                         @Nonnull String complianceText) {
        Map<String, String> placeholders = new LinkedHashMap<>();
        placeholders.put("{{FILE_PATH}}", path);
        placeholders.put("{{LANGUAGE}}", language);
        placeholders.put("{{STANDARDS}}", truncate(complianceText, MAX_COMPLIANCE_CHARS));
        placeholders.put("{{CODE}}", truncate(redactedCode, MAX_CODE_CHARS));
        return applyPlaceholders(template, placeholders);
    }

    static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxChars) {
            return value;
        }
        int end = maxChars;
        // never end on half of a surrogate pair
        if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    // Single pass so that placeholder-like text inside the code is left alone.
    private static String applyPlaceholders(String template, Map<String, String> replacements) {
        StringBuilder rendered = new StringBuilder(template.length() + 1024);
        int index = 0;
        while (index < template.length()) {
            int open = template.indexOf("{{", index);
            if (open < 0) {
                rendered.append(template, index, template.length());
                break;
            }
            int close = template.indexOf("}}", open + 2);
            if (close < 0) {
                rendered.append(template, index, template.length());
                break;
            }
            String key = template.substring(open, close + 2);
            String value = replacements.get(key);
            rendered.append(template, index, open);
            rendered.append(value != null ? value : key);
            index = close + 2;
        }
        return rendered.toString();
    }
}
