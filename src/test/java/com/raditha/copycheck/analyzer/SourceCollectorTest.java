package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.config.DetectionConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceCollectorTest {

    @TempDir
    Path tempDir;

    @Test
    void testWalksDirectoryAndFiltersExtensions() throws IOException {
        write("b.cpp", "int b;");
        write("a.h", "int a;");
        write("notes.txt", "ignore me");
        write("nested/c.HPP", "int c;");

        List<SourceFile> files = new SourceCollector(DetectionConfig.moderate()).collect(List.of(tempDir));

        assertEquals(List.of("a.h", "b.cpp", "c.HPP"), files.stream().map(SourceFile::displayName).toList());
        assertEquals("int a;", files.get(0).content());
    }

    @Test
    void testExcludePatternsApplied() throws IOException {
        write("main.cpp", "int m;");
        write("build/generated.cpp", "int g;");
        write("vendor/lib.cpp", "int v;");
        DetectionConfig config = new DetectionConfig(0.7, List.of(".cpp"),
                List.of("**/build/**", "**/vendor/**"), 10);

        List<SourceFile> files = new SourceCollector(config).collect(List.of(tempDir));

        assertEquals(List.of("main.cpp"), files.stream().map(SourceFile::displayName).toList());
    }

    @Test
    void testBuildAncestorDoesNotExcludeInput() throws IOException {
        write("build/hw1/a.cpp", "int a;");
        write("build/hw1/b.cpp", "int b;");
        write("build/hw1/build/generated.cpp", "int g;");
        Path root = tempDir.resolve("build/hw1");

        List<SourceFile> files = new SourceCollector(DetectionConfig.moderate()).collect(List.of(root));

        assertEquals(List.of("a.cpp", "b.cpp"), files.stream().map(SourceFile::displayName).toList());
    }

    @Test
    void testExplicitFilesNeverExcluded() throws IOException {
        Path generated = write("target/gen.cpp", "int g;");
        Path main = write("main.cpp", "int m;");

        List<SourceFile> files = new SourceCollector(DetectionConfig.moderate())
                .collect(List.of(generated, tempDir, main));

        assertEquals(List.of("main.cpp", "gen.cpp"), files.stream().map(SourceFile::displayName).toList());
    }

    @Test
    void testExplicitFilesDeduplicated() throws IOException {
        Path a = write("a.cpp", "int a;");
        write("b.cpp", "int b;");

        List<SourceFile> files = new SourceCollector(DetectionConfig.moderate()).collect(List.of(a, tempDir, a));

        assertEquals(2, files.size());
    }

    @Test
    void testUnsupportedExplicitFileSkipped() throws IOException {
        Path text = write("readme.md", "# hi");

        List<SourceFile> files = new SourceCollector(DetectionConfig.moderate()).collect(List.of(text));

        assertTrue(files.isEmpty());
    }

    @Test
    void testMissingPathRejected() {
        SourceCollector collector = new SourceCollector(DetectionConfig.moderate());
        Path missing = tempDir.resolve("nope.cpp");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> collector.collect(List.of(missing)));
        assertTrue(ex.getMessage().startsWith("Input path not found"));
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
