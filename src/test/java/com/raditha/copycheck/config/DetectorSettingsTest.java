package com.raditha.copycheck.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for YAML loading and CLI override priority.
 */
class DetectorSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultsWithoutConfigFile() throws IOException {
        DetectionConfig config = DetectorSettings.loadConfig(null, 0, null);

        assertEquals(DetectionConfig.moderate(), config);
    }

    @Test
    void testCliThresholdWithoutFile() throws IOException {
        assertEquals(0.85, DetectorSettings.loadConfig(null, 85, null).threshold(), 0.001);
        assertEquals(0.90, DetectorSettings.loadConfig(null, 0, "strict").threshold(), 0.001);
        assertEquals(0.60, DetectorSettings.loadConfig(null, 60, "strict").threshold(), 0.001);
    }

    @Test
    void testYamlValuesApplied() throws IOException {
        Path file = yaml("""
                detector:
                  threshold: 0.8
                  extensions: [".cc", "cpp"]
                  exclude_patterns: ["**/vendor/**"]
                  max_segments: 3
                """);

        DetectionConfig config = DetectorSettings.loadConfig(file, 0, null);

        assertEquals(0.8, config.threshold(), 0.001);
        assertEquals(List.of(".cc", ".cpp"), config.extensions());
        assertEquals(List.of("**/vendor/**"), config.excludePatterns());
        assertEquals(3, config.maxSegments());
    }

    @Test
    void testPresetOverridesYamlThreshold() throws IOException {
        Path file = yaml("""
                detector:
                  preset: lenient
                  threshold: 0.8
                """);

        DetectionConfig config = DetectorSettings.loadConfig(file, 0, null);

        assertEquals(0.50, config.threshold(), 0.001);
        assertEquals(20, config.maxSegments());
    }

    @Test
    void testCliOverridesYaml() throws IOException {
        Path file = yaml("""
                detector:
                  preset: lenient
                  threshold: 0.8
                """);

        assertEquals(0.90, DetectorSettings.loadConfig(file, 0, "strict").threshold(), 0.001);
        assertEquals(0.75, DetectorSettings.loadConfig(file, 75, "strict").threshold(), 0.001);
    }

    @Test
    void testMissingSectionFallsBackToDefaults() throws IOException {
        Path file = yaml("other:\n  key: value\n");

        assertEquals(DetectionConfig.moderate(), DetectorSettings.loadConfig(file, 0, null));
    }

    @Test
    void testMissingFileRejected() {
        Path missing = tempDir.resolve("absent.yml");

        assertThrows(IllegalArgumentException.class, () -> DetectorSettings.loadConfig(missing, 0, null));
    }

    @Test
    void testMalformedYamlIsConfigurationError() throws IOException {
        Path file = yaml("detector:\n  threshold: [0.5\n");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> DetectorSettings.loadConfig(file, 0, null));
        assertTrue(ex.getMessage().startsWith("Invalid config file"));
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void testInvalidThresholdInYamlRejected() throws IOException {
        Path file = yaml("detector:\n  threshold: 4.0\n");

        assertThrows(IllegalArgumentException.class, () -> DetectorSettings.loadConfig(file, 0, null));
    }

    private Path yaml(String content) throws IOException {
        Path file = tempDir.resolve(DetectorSettings.DEFAULT_CONFIG_FILE);
        Files.writeString(file, content);
        return file;
    }
}
