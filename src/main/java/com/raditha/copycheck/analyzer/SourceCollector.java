package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.config.DetectionConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Expands files and directories into the source files to compare.
 * Only files with a configured extension are kept. Exclude patterns are
 * matched against each file's path relative to the directory it was found
 * in, so the directories above an input never cause exclusion. Files named
 * directly are never excluded.
 */
public class SourceCollector {

    private static final Logger logger = LoggerFactory.getLogger(SourceCollector.class);

    private final DetectionConfig config;

    public SourceCollector(DetectionConfig config) {
        this.config = config;
    }

    /**
     * Collect source files, sorted by path and without duplicates.
     *
     * @throws IllegalArgumentException if an input path does not exist
     * @throws IOException              if a directory or file cannot be read
     */
    public List<SourceFile> collect(List<Path> inputs) throws IOException {
        // absolute path -> path matched against exclude patterns; null for files named explicitly
        Map<Path, @Nullable String> candidates = new LinkedHashMap<>();
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                throw new IllegalArgumentException("Input path not found: " + input);
            }
            if (Files.isDirectory(input)) {
                Path root = input.toAbsolutePath().normalize();
                try (Stream<Path> walk = Files.walk(root)) {
                    walk.filter(Files::isRegularFile)
                            .filter(config::acceptsExtension)
                            .filter(p -> !candidates.containsKey(p))
                            .forEach(p -> candidates.put(p, root.relativize(p).toString()));
                }
            } else if (config.acceptsExtension(input)) {
                candidates.put(input.toAbsolutePath().normalize(), null);
            } else {
                logger.warn("Skipping {}: only {} files are supported", input, String.join(", ", config.extensions()));
            }
        }

        List<SourceFile> files = new ArrayList<>();
        for (Path path : candidates.keySet().stream().sorted(Comparator.comparing(Path::toString)).toList()) {
            String relative = candidates.get(path);
            if (relative != null && config.shouldExclude(relative)) {
                logger.info("Excluded by pattern: {}", path);
                continue;
            }
            files.add(read(path));
        }
        return files;
    }

    /**
     * Read a file as UTF-8; malformed bytes are replaced rather than rejected.
     */
    static SourceFile read(Path path) throws IOException {
        return new SourceFile(path, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }
}
