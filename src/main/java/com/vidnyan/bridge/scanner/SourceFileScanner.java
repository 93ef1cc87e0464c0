package com.vidnyan.bridge.scanner;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Scans a directory for Rust and WGSL source files.
 * Build output and hidden directories are skipped.
 */
@Component
public class SourceFileScanner {

    private static final Set<String> EXTENSIONS = Set.of(".rs", ".wgsl");
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("target", "node_modules");

    /**
     * All source files under {@code root}, sorted by path.
     */
    public List<Path> scanSourceFiles(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> isSourceFile(p.getFileName().toString()))
                    .filter(p -> !inSkippedDirectory(root.relativize(p)))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Contents of every source file under {@code root}, keyed by path relative to
     * the root with '/' separators, in scan order.
     */
    public Map<String, String> readSources(Path root) throws IOException {
        Map<String, String> sources = new LinkedHashMap<>();
        for (Path file : scanSourceFiles(root)) {
            String name = root.relativize(file).toString().replace('\\', '/');
            sources.put(name, Files.readString(file, StandardCharsets.UTF_8));
        }
        return sources;
    }

    static boolean isSourceFile(String filename) {
        return EXTENSIONS.stream().anyMatch(filename::endsWith);
    }

    private static boolean inSkippedDirectory(Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            String directory = relative.getName(i).toString();
            if (directory.startsWith(".") || SKIPPED_DIRECTORIES.contains(directory)) {
                return true;
            }
        }
        return false;
    }
}
