package com.teknolojikpanda.codereview.core;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LanguageDetectorTest {

    @Test
    public void detectsBySuffix() {
        assertEquals("typescript", LanguageDetector.detect("src/app/main.tsx"));
        assertEquals("python", LanguageDetector.detect("tools/build.PY"));
        assertEquals("csharp", LanguageDetector.detect("Program.cs"));
        assertEquals("svelte", LanguageDetector.detect("ui/Button.svelte"));
    }

    @Test
    public void unknownSuffixFallsBackToText() {
        assertEquals(LanguageDetector.UNKNOWN, LanguageDetector.detect("README.md"));
        assertEquals(LanguageDetector.UNKNOWN, LanguageDetector.detect("Makefile"));
        assertEquals(LanguageDetector.UNKNOWN, LanguageDetector.detect("dir.js/notes."));
        assertEquals(LanguageDetector.UNKNOWN, LanguageDetector.detect(null));
    }

    @Test
    public void supportsSeventeenExtensions() {
        assertEquals(17, LanguageDetector.supportedExtensions().size());
        assertTrue(LanguageDetector.isSupported("lib/mod.rs"));
        assertFalse(LanguageDetector.isSupported("config.yaml"));
    }
}
