package com.teknolojikpanda.codereview.core;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PromptRendererTest {

    private final PromptRenderer renderer = new PromptRenderer();

    @Test
    public void includesPathLanguageStandardsAndCode() {
        String prompt = renderer.render("src/app.ts", "const a = 1;", "typescript", "Use const.");

        assertTrue(prompt.contains("File: src/app.ts"));
        assertTrue(prompt.contains("Language: typescript"));
        assertTrue(prompt.contains("Use const."));
        assertTrue(prompt.contains("const a = 1;"));
        assertTrue(prompt.indexOf("Use const.") < prompt.indexOf("const a = 1;"));
    }

    @Test
    public void boundsStandardsAndCode() {
        String standards = "Q".repeat(PromptRenderer.MAX_COMPLIANCE_CHARS + 500);
        String code = "Z".repeat(PromptRenderer.MAX_CODE_CHARS + 500);

        String prompt = renderer.render("big.js", code, "javascript", standards);

        assertTrue(prompt.contains("Q".repeat(PromptRenderer.MAX_COMPLIANCE_CHARS)));
        assertFalse(prompt.contains("Q".repeat(PromptRenderer.MAX_COMPLIANCE_CHARS + 1)));
        assertTrue(prompt.contains("Z".repeat(PromptRenderer.MAX_CODE_CHARS)));
        assertFalse(prompt.contains("Z".repeat(PromptRenderer.MAX_CODE_CHARS + 1)));
    }

    @Test
    public void truncationKeepsSurrogatePairsWhole() {
        String emoji = "\uD83D\uDE00";
        String code = "a".repeat(PromptRenderer.MAX_CODE_CHARS - 1) + emoji + "tail";

        String prompt = renderer.render("emoji.js", code, "javascript", "");

        assertTrue(prompt.contains("a".repeat(PromptRenderer.MAX_CODE_CHARS - 1)));
        assertFalse(prompt.contains("\uD83D"));
        assertEquals("ab", PromptRenderer.truncate("ab" + emoji, 3));
        assertEquals("ab" + emoji, PromptRenderer.truncate("ab" + emoji + "c", 4));
    }

    @Test
    public void placeholderTextInsideCodeIsNotExpanded() {
        String prompt = renderer.render("t.js", "const s = '{{STANDARDS}}';", "javascript", "RULES");

        assertTrue(prompt.contains("const s = '{{STANDARDS}}';"));
        assertEquals(prompt.indexOf("RULES"), prompt.lastIndexOf("RULES"));
    }

    @Test
    public void customTemplateIsHonoured() {
        PromptRenderer custom = new PromptRenderer("{{LANGUAGE}}|{{FILE_PATH}}|{{UNKNOWN}}");

        assertEquals("go|main.go|{{UNKNOWN}}", custom.render("main.go", "package main", "go", ""));
    }
}
