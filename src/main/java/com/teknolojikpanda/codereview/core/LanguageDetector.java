package com.teknolojikpanda.codereview.core;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps file suffixes to language names used in prompts.
 */
public final class LanguageDetector {

    public static final String UNKNOWN = "text";

    private static final Map<String, String> LANGUAGES;

    static {
        Map<String, String> map = new HashMap<>();
        map.put("js", "javascript");
        map.put("jsx", "javascript");
        map.put("ts", "typescript");
        map.put("tsx", "typescript");
        map.put("py", "python");
        map.put("java", "java");
        map.put("kt", "kotlin");
        map.put("cpp", "cpp");
        map.put("c", "c");
        map.put("cs", "csharp");
        map.put("go", "go");
        map.put("rs", "rust");
        map.put("php", "php");
        map.put("rb", "ruby");
        map.put("swift", "swift");
        map.put("vue", "vue");
        map.put("svelte", "svelte");
        LANGUAGES = Collections.unmodifiableMap(map);
    }

    private LanguageDetector() {
    }

    @Nonnull
    public static String detect(@Nullable String path) {
        String extension = extension(path);
        if (extension == null) {
            return UNKNOWN;
        }
        return LANGUAGES.getOrDefault(extension, UNKNOWN);
    }

    public static boolean isSupported(@Nullable String path) {
        String extension = extension(path);
        return extension != null && LANGUAGES.containsKey(extension);
    }

    @Nonnull
    public static Set<String> supportedExtensions() {
        return LANGUAGES.keySet();
    }

    @Nullable
    private static String extension(@Nullable String path) {
        if (path == null) {
            return null;
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String name = path.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ENGLISH);
    }
}
