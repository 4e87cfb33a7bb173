package com.teknolojikpanda.codereview.source;

import com.teknolojikpanda.codereview.api.SourceProvider;
import com.teknolojikpanda.codereview.core.LanguageDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads source files from a checked-out working tree. The repository and branch references are
 * informational only; the tree on disk is used as is.
 */
public class LocalDirectorySourceProvider implements SourceProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalDirectorySourceProvider.class);

    public static final int DEFAULT_MAX_FILES = 20;

    private final Path root;
    private final int maxFiles;

    public LocalDirectorySourceProvider(@Nonnull Path root) {
        this(root, DEFAULT_MAX_FILES);
    }

    public LocalDirectorySourceProvider(@Nonnull Path root, int maxFiles) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.maxFiles = Math.max(1, maxFiles);
    }

    /**
     * Lists recognised source files, relative to the root with {@code /} separators, sorted and
     * capped. Files under hidden directories such as {@code .git} are skipped.
     */
    @Nonnull
    @Override
    public List<String> listFiles(@Nonnull String repositoryRef, @Nonnull String branchRef) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Source directory does not exist: " + root);
        }
        List<String> files;
        try (Stream<Path> paths = Files.walk(root)) {
            files = paths
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(relative -> !isHidden(relative))
                    .map(relative -> relative.toString().replace('\\', '/'))
                    .filter(LanguageDetector::isSupported)
                    .sorted()
                    .limit(maxFiles)
                    .collect(Collectors.toList());
        }
        log.debug("Found {} source file(s) under {} for {}@{}", files.size(), root, repositoryRef, branchRef);
        return files;
    }

    @Nonnull
    @Override
    public String readFile(@Nonnull String path) throws IOException {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IOException("Path escapes the source directory: " + path);
        }
        // malformed bytes become U+FFFD so non-UTF-8 files are still reviewed
        return new String(Files.readAllBytes(resolved), StandardCharsets.UTF_8);
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
