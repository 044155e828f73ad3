package com.raditha.copycheck.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads detector configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > copycheck.yml > defaults
 * <pre>
 * detector:
 *   preset: strict          # optional: strict | moderate | lenient
 *   threshold: 0.8          # ignored when a preset is chosen
 *   extensions: [".cpp", ".h"]
 *   exclude_patterns: ["**&#47;vendor/**"]
 *   max_segments: 5
 * </pre>
 */
public class DetectorSettings {

    private static final Logger logger = LoggerFactory.getLogger(DetectorSettings.class);

    public static final String DEFAULT_CONFIG_FILE = "copycheck.yml";

    static final String CONFIG_KEY = "detector";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private DetectorSettings() {
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile   YAML file (null = none)
     * @param thresholdCLI CLI threshold percentage 0-100 (0 = use YAML/default)
     * @param presetCLI    CLI preset name (null = use YAML/default)
     * @return complete detection configuration
     * @throws IllegalArgumentException if the config file is missing, is not
     *                                  valid YAML or holds invalid values
     * @throws IOException              if the config file cannot be read
     */
    public static DetectionConfig loadConfig(@Nullable Path configFile, int thresholdCLI, @Nullable String presetCLI)
            throws IOException {
        JsonNode config = readSection(configFile);
        if (config == null) {
            return createFromCLI(thresholdCLI, presetCLI);
        }

        // Determine preset (CLI > YAML)
        String preset = presetCLI != null ? presetCLI : getString(config, "preset");
        DetectionConfig base = preset != null ? DetectionConfig.preset(preset) : DetectionConfig.moderate();

        double threshold;
        if (thresholdCLI != 0) {
            threshold = thresholdCLI / 100.0;
        } else if (preset != null) {
            threshold = base.threshold();
        } else {
            threshold = getDouble(config, "threshold", base.threshold());
        }

        return new DetectionConfig(
                threshold,
                getStringList(config, "extensions", base.extensions()),
                getStringList(config, "exclude_patterns", base.excludePatterns()),
                getInt(config, "max_segments", base.maxSegments()));
    }

    private static DetectionConfig createFromCLI(int thresholdCLI, @Nullable String presetCLI) {
        DetectionConfig base = presetCLI != null ? DetectionConfig.preset(presetCLI) : DetectionConfig.moderate();
        if (thresholdCLI != 0) {
            return base.withThreshold(thresholdCLI / 100.0);
        }
        return base;
    }

    /**
     * Read the {@value #CONFIG_KEY} section, or null when there is nothing to
     * read.
     */
    private static @Nullable JsonNode readSection(@Nullable Path configFile) throws IOException {
        if (configFile == null) {
            return null;
        }
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        JsonNode root;
        try {
            root = YAML.readTree(configFile.toFile());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config file " + configFile + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.path(CONFIG_KEY).isObject()) {
            logger.warn("No '{}' section in {}; using defaults", CONFIG_KEY, configFile);
            return null;
        }
        return root.get(CONFIG_KEY);
    }

    private static @Nullable String getString(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value != null && value.isValueNode() && !value.isNull()) {
            return value.asText();
        }
        return null;
    }

    private static double getDouble(JsonNode node, String key, double defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isNumber()) {
            return value.doubleValue();
        }
        return defaultValue;
    }

    private static int getInt(JsonNode node, String key, int defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isNumber()) {
            return value.intValue();
        }
        return defaultValue;
    }

    private static List<String> getStringList(JsonNode node, String key, List<String> defaultValue) {
        JsonNode value = node.get(key);
        if (value == null || !value.isArray() || value.isEmpty()) {
            return defaultValue;
        }
        List<String> result = new ArrayList<>();
        value.forEach(item -> result.add(item.asText()));
        return result;
    }
}
