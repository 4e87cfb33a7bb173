package com.teknolojikpanda.codereview.core;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Masks credentials in source text before it leaves the process.
 * <p>
 * Rules run in table order. Each rule keeps the key name and separator and replaces only the
 * value with {@value #MASK}, so running the redactor twice gives the same text as running it once.
 */
public final class SecretRedactor {

    public static final String MASK = "***";

    private static final List<Rule> DEFAULT_RULES = List.of(
            new Rule("access-key", "(?i)(access[_-]?key\\s*[:=]\\s*[\"']?)[A-Za-z0-9_\\-]+", "$1" + MASK),
            new Rule("secret-key", "(?i)(secret[_-]?key\\s*[:=]\\s*[\"']?)[A-Za-z0-9_\\-]+", "$1" + MASK),
            new Rule("api-key", "(?i)(api[_-]?key\\s*[:=]\\s*[\"']?)[A-Za-z0-9_\\-]+", "$1" + MASK),
            new Rule("bearer", "(?i)(bearer\\s+)[A-Za-z0-9._\\-]+", "$1" + MASK),
            new Rule("token", "(?i)(token\\s*[:=]\\s*[\"']?)[A-Za-z0-9._\\-]+", "$1" + MASK),
            new Rule("password", "(?i)(password\\s*[:=]\\s*[\"']?)[^\\s\"']+", "$1" + MASK),
            new Rule("aws-access-key-id", "AKIA[0-9A-Z]{16}", MASK));

    private final List<Rule> rules;

    public SecretRedactor() {
        this(DEFAULT_RULES);
    }

    public SecretRedactor(@Nonnull List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rules, "rules")));
    }

    @Nonnull
    public String redact(@Nonnull String content) {
        String result = Objects.requireNonNull(content, "content");
        for (Rule rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }

    @Nonnull
    public List<Rule> getRules() {
        return rules;
    }

    /**
     * A single masking rule: a pattern and its replacement template.
     */
    public static final class Rule {
        private final String id;
        private final Pattern pattern;
        private final String replacement;

        public Rule(@Nonnull String id, @Nonnull String regex, @Nonnull String replacement) {
            this.id = Objects.requireNonNull(id, "id");
            this.pattern = Pattern.compile(regex);
            this.replacement = Objects.requireNonNull(replacement, "replacement");
        }

        @Nonnull
        public String getId() {
            return id;
        }

        String apply(String input) {
            return pattern.matcher(input).replaceAll(replacement);
        }
    }
}
