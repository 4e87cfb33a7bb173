package com.teknolojikpanda.codereview.core;

import com.teknolojikpanda.codereview.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.inject.Inject;
import javax.inject.Named;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs the cheap local checks over a file. Deterministic and free of side effects; a rule that
 * blows up is skipped rather than failing the analysis.
 */
@Named
public class HeuristicAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(HeuristicAnalyzer.class);

    private final List<HeuristicRule> rules;

    @Inject
    public HeuristicAnalyzer() {
        this(HeuristicRules.defaults());
    }

    public HeuristicAnalyzer(@Nonnull List<HeuristicRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rules, "rules")));
    }

    /**
     * Line findings come first, ordered by line and then by rule order; whole-file findings follow.
     */
    @Nonnull
    public List<Finding> analyze(@Nonnull String path, @Nonnull String content) {
        if (content == null || content.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> lines = SourceLines.split(content);
        List<Finding> findings = new ArrayList<>();
        for (int index = 0; index < lines.size(); index++) {
            for (HeuristicRule rule : rules) {
                try {
                    rule.checkLine(lines, index).ifPresent(findings::add);
                } catch (RuntimeException ex) {
                    log.warn("Heuristic rule {} failed on {}:{}: {}", rule.id(), path, index + 1, ex.getMessage());
                }
            }
        }
        for (HeuristicRule rule : rules) {
            try {
                rule.checkFile(content, lines).ifPresent(findings::add);
            } catch (RuntimeException ex) {
                log.warn("Heuristic rule {} failed on {}: {}", rule.id(), path, ex.getMessage());
            }
        }
        return findings;
    }
}
