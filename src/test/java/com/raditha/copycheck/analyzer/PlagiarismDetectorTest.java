package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.model.Document;
import com.raditha.copycheck.model.Range;
import com.raditha.copycheck.model.Segment;
import com.raditha.copycheck.model.SimilarityResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for PlagiarismDetector.
 */
class PlagiarismDetectorTest {

    private PlagiarismDetector detector;

    @BeforeEach
    void setUp() {
        detector = new PlagiarismDetector();
    }

    @Test
    void testRenamedFunctionIsFullMatch() {
        String a = """
                int add(int a, int b) {
                  return a + b;
                }
                """;
        String b = """
                int sum(int x, int y) {
                    return x + y;
                }
                """;

        SimilarityResult result = detector.detect(a, b, 0.7);

        assertEquals(1.0, result.similarityScore(), 0.001);
        assertEquals(List.of(new Segment(0, 2, 0, 2, List.of(
                "int VAR_1(int VAR_2, int VAR_3) {",
                "return VAR_2 + VAR_3;",
                "}"))), result.matchedSegments());
    }

    @Test
    void testTooShortDocuments() {
        SimilarityResult result = detector.detect("int a = 1;\nint b = 2;", "int a = 1;\nint b = 2;", 0.7);

        assertEquals(0.0, result.similarityScore());
        assertTrue(result.matchedSegments().isEmpty());
    }

    @Test
    void testUnrelatedCode() {
        SimilarityResult result = detector.detect(
                "int x = 1;\nint y = 2;\nint z = x + y;",
                "while (running) {\nprocess();\n}",
                0.7);

        assertEquals(0.0, result.similarityScore());
        assertTrue(result.matchedSegments().isEmpty());
    }

    @Test
    void testPartialOverlap() {
        String a = "int a = 1;\nint b = 2;\nint c = a + b;\nwhile (c > 0) {";
        String b = "int x = 5;\nint y = 7;\nint z = x + y;\nprint(z);";

        SimilarityResult result = detector.detect(a, b, 0.7);

        assertEquals(1.0 / 3, result.similarityScore(), 0.001);
        assertEquals(1, result.matchedSegments().size());
        Segment segment = result.matchedSegments().get(0);
        assertEquals(0, segment.start1());
        assertEquals(2, segment.end1());
        assertEquals(0, segment.start2());
        assertEquals(2, segment.end2());
    }

    @Test
    void testCommentsAndBlankLinesIgnored() {
        String plain = "int f(int n) {\nreturn n * 2;\n}";
        String noisy = "// doubles\n\nint g(int k) { /* entry */\n\n  return k * 2; // result\n}\n";

        assertEquals(1.0, detector.detect(plain, noisy, 0.5).similarityScore(), 0.001);
    }

    @Test
    void testThresholdDoesNotChangeResult() {
        String a = "int a = 1;\nint b = 2;\nint c = a + b;\nwhile (c > 0) {";
        String b = "int x = 5;\nint y = 7;\nint z = x + y;\nprint(z);";

        assertEquals(detector.detect(a, b, 0.0), detector.detect(a, b, 1.0));
    }

    @Test
    void testNullAndEmptyInputs() {
        assertEquals(0.0, detector.detect(null, null, 0.7).similarityScore());
        assertEquals(0.0, detector.detect("", "int a;\nint b;\nint c;", 0.7).similarityScore());
    }

    @Test
    void testSegmentsMapBackToSourceLines() {
        String code = "// header\nint add(int a, int b) {\n\n  return a + b;\n}";

        DetectionReport report = detector.analyze(Document.of(code), Document.of(code));

        Segment segment = report.result().matchedSegments().get(0);
        assertEquals(new Range(2, 5), report.sourceRangeInFirst(segment));
        assertEquals(new Range(2, 5), report.sourceRangeInSecond(segment));
        assertEquals(3, report.first().size());
    }
}
