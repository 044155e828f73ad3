package com.raditha.copycheck.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Configuration for a batch plagiarism check.
 * The detection engine itself ignores the threshold; it is applied when
 * flagging pairs in reports.
 *
 * @param threshold       Minimum similarity score to flag (0.0-1.0)
 * @param extensions      File extensions to compare (e.g. ".cpp")
 * @param excludePatterns File patterns to exclude (glob format)
 * @param maxSegments     Maximum segments printed per pair in text reports
 */
public record DetectionConfig(
        double threshold,
        List<String> extensions,
        List<String> excludePatterns,
        int maxSegments) {

    /**
     * Validate configuration.
     */
    public DetectionConfig {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (extensions == null || extensions.isEmpty()) {
            extensions = defaultExtensions();
        }
        extensions = extensions.stream()
                .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        if (maxSegments < 1) {
            throw new IllegalArgumentException("maxSegments must be >= 1");
        }
    }

    /**
     * Moderate preset: 70% threshold. Good default for most assignments.
     */
    public static DetectionConfig moderate() {
        return new DetectionConfig(0.70, defaultExtensions(), defaultExcludePatterns(), 10);
    }

    /**
     * Strict preset: only flag near-copies (90% threshold).
     */
    public static DetectionConfig strict() {
        return new DetectionConfig(0.90, defaultExtensions(), defaultExcludePatterns(), 10);
    }

    /**
     * Lenient preset: flag anything half similar (50% threshold).
     * Expect more false positives.
     */
    public static DetectionConfig lenient() {
        return new DetectionConfig(0.50, defaultExtensions(), defaultExcludePatterns(), 20);
    }

    /**
     * Resolve a preset by name; unknown names give {@link #moderate()}.
     */
    public static DetectionConfig preset(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            default -> moderate();
        };
    }

    public DetectionConfig withThreshold(double newThreshold) {
        return new DetectionConfig(newThreshold, extensions, excludePatterns, maxSegments);
    }

    static List<String> defaultExtensions() {
        return List.of(".cpp", ".h", ".hpp");
    }

    static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/node_modules/**",
                "**/.git/**");
    }

    /**
     * Check whether a file has one of the configured extensions.
     */
    public boolean acceptsExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** (any depth, including none when followed by /) and *
     * (within one path element).
     */
    private static boolean matchesGlobPattern(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("**/", "\u0001")
                .replace("**", "\u0000")
                .replace("*", "[^/]*")
                .replace("\u0001", "(?:.*/)?")
                .replace("\u0000", ".*");
        return path.matches(regex);
    }
}
