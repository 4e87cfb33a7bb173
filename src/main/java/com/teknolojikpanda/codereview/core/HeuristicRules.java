package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.Finding;
import com.teknolojikpanda.codereview.model.FindingCategory;
import com.teknolojikpanda.codereview.model.FindingKind;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in heuristic rules, in the order they are applied.
 */
public final class HeuristicRules {

    static final int MAX_LINE_LENGTH = 120;
    static final int MAX_DEFINITIONS = 10;

    private static final Pattern DEBUG_PRINT = Pattern.compile(
            "\\bconsole\\.\\w+\\s*\\("
                    + "|\\bSystem\\.(?:out|err)\\.print(?:ln|f)?\\s*\\("
                    + "|\\bprintStackTrace\\s*\\("
                    + "|\\bfmt\\.Print(?:ln|f)?\\s*\\("
                    + "|\\bprintln!\\s*\\("
                    + "|\\bvar_dump\\s*\\("
                    + "|(?<![.\\w])print\\s*\\(");
    private static final Pattern DEFINITION = Pattern.compile(
            "\\bfunction\\s+\\w+"
                    + "|\\bconst\\s+\\w+\\s*=\\s*\\([^)]*\\)\\s*=>"
                    + "|\\bclass\\s+\\w+"
                    + "|\\bdef\\s+\\w+"
                    + "|\\bfunc\\s+\\w+"
                    + "|\\bfn\\s+\\w+");

    private HeuristicRules() {
    }

    @Nonnull
    public static List<HeuristicRule> defaults() {
        return List.of(
                new TrailingWhitespaceRule(),
                new LineLengthRule(),
                new TodoMarkerRule(),
                new DebugPrintRule(),
                new MissingFinalNewlineRule(),
                new DefinitionCountRule());
    }

    private static Finding lineFinding(List<String> lines, int index, FindingKind kind, FindingCategory category,
                                       String message, String suggestion) {
        return Finding.builder()
                .line(index + 1)
                .kind(kind)
                .category(category)
                .message(message)
                .suggestion(suggestion)
                .sourceLine(lines.get(index))
                .contextLines(SourceLines.window(lines, index))
                .build();
    }

    /**
     * Start of a line comment, or -1. Lines opening with a block-comment marker count as comment
     * from the first character.
     */
    static int commentStart(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("#") || trimmed.startsWith("*") || trimmed.startsWith("/*")) {
            return line.indexOf(trimmed.charAt(0));
        }
        return line.indexOf("//");
    }

    static final class TrailingWhitespaceRule implements HeuristicRule {
        @Nonnull
        @Override
        public String id() {
            return "trailing-whitespace";
        }

        @Nonnull
        @Override
        public Optional<Finding> checkLine(@Nonnull List<String> lines, int index) {
            String line = lines.get(index);
            if (!line.endsWith(" ") && !line.endsWith("\t")) {
                return Optional.empty();
            }
            return Optional.of(lineFinding(lines, index, FindingKind.STYLE, FindingCategory.MAINTAINABILITY,
                    "Line ends with trailing spaces or tabs",
                    "Remove the trailing whitespace"));
        }
    }

    static final class LineLengthRule implements HeuristicRule {
        @Nonnull
        @Override
        public String id() {
            return "line-length";
        }

        @Nonnull
        @Override
        public Optional<Finding> checkLine(@Nonnull List<String> lines, int index) {
            if (lines.get(index).length() <= MAX_LINE_LENGTH) {
                return Optional.empty();
            }
            return Optional.of(lineFinding(lines, index, FindingKind.WARNING, FindingCategory.READABILITY,
                    "Line is longer than " + MAX_LINE_LENGTH + " characters",
                    "Split the line to keep it readable"));
        }
    }

    static final class TodoMarkerRule implements HeuristicRule {
        @Nonnull
        @Override
        public String id() {
            return "todo-marker";
        }

        @Nonnull
        @Override
        public Optional<Finding> checkLine(@Nonnull List<String> lines, int index) {
            String lower = lines.get(index).toLowerCase(Locale.ENGLISH);
            if (!lower.contains("todo") && !lower.contains("fixme")) {
                return Optional.empty();
            }
            return Optional.of(lineFinding(lines, index, FindingKind.INFO, FindingCategory.MAINTAINABILITY,
                    "TODO/FIXME marker left in code",
                    "Resolve the item or track it in the issue tracker"));
        }
    }

    static final class DebugPrintRule implements HeuristicRule {
        @Nonnull
        @Override
        public String id() {
            return "debug-print";
        }

        @Nonnull
        @Override
        public Optional<Finding> checkLine(@Nonnull List<String> lines, int index) {
            String line = lines.get(index);
            Matcher matcher = DEBUG_PRINT.matcher(line);
            if (!matcher.find()) {
                return Optional.empty();
            }
            int comment = commentStart(line);
            if (comment >= 0 && comment <= matcher.start()) {
                return Optional.empty();
            }
            return Optional.of(lineFinding(lines, index, FindingKind.WARNING, FindingCategory.BEST_PRACTICES,
                    "Debug print statement in code",
                    "Remove debug output or route it through the project logger"));
        }
    }

    static final class MissingFinalNewlineRule implements HeuristicRule {
        @Nonnull
        @Override
        public String id() {
            return "final-newline";
        }

        @Nonnull
        @Override
        public Optional<Finding> checkFile(@Nonnull String content, @Nonnull List<String> lines) {
            if (content.isEmpty() || content.endsWith("\n")) {
                return Optional.empty();
            }
            return Optional.of(lineFinding(lines, lines.size() - 1, FindingKind.STYLE, FindingCategory.MAINTAINABILITY,
                    "File does not end with a newline",
                    "Add a newline at the end of the file"));
        }
    }

    static final class DefinitionCountRule implements HeuristicRule {
        @Nonnull
        @Override
        public String id() {
            return "definition-count";
        }

        @Nonnull
        @Override
        public Optional<Finding> checkFile(@Nonnull String content, @Nonnull List<String> lines) {
            Matcher matcher = DEFINITION.matcher(content);
            int count = 0;
            while (matcher.find()) {
                count++;
            }
            if (count <= MAX_DEFINITIONS) {
                return Optional.empty();
            }
            return Optional.of(lineFinding(lines, 0, FindingKind.WARNING, FindingCategory.MAINTAINABILITY,
                    "File defines " + count + " functions/classes",
                    "Split the file so each one focuses on a single responsibility"));
        }
    }
}
