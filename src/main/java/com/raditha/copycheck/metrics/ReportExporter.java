package com.raditha.copycheck.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.copycheck.analyzer.DetectionReport;
import com.raditha.copycheck.analyzer.PairResult;
import com.raditha.copycheck.analyzer.PlagiarismReport;
import com.raditha.copycheck.model.Range;
import com.raditha.copycheck.model.Segment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Exports plagiarism check results to CSV and JSON for dashboards and
 * historical tracking.
 */
public class ReportExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Aggregated metrics for one batch run.
     */
    public record ProjectMetrics(
            String projectName,
            LocalDateTime timestamp,
            int totalFiles,
            int totalPairs,
            int flaggedPairs,
            double threshold,
            double averageSimilarity,
            double maxSimilarity,
            List<PairMetrics> pairs) {
    }

    /**
     * Per-pair metrics.
     */
    public record PairMetrics(
            String file1,
            String file2,
            double similarity,
            int segmentCount,
            boolean flagged) {
    }

    /**
     * Full report DTO for JSON output, including segments.
     */
    public record JsonReport(
            String version,
            int filesAnalyzed,
            double threshold,
            int flaggedPairs,
            List<JsonPair> pairs) {
    }

    public record JsonPair(
            String file1,
            String file2,
            double similarityScore,
            String severity,
            boolean flagged,
            List<JsonSegment> matchedSegments) {
    }

    /**
     * Segment in normalized coordinates plus the raw line ranges they map to.
     */
    public record JsonSegment(
            int start1,
            int end1,
            int start2,
            int end2,
            int sourceStart1,
            int sourceEnd1,
            int sourceStart2,
            int sourceEnd2,
            List<String> lines) {
    }

    /**
     * Build aggregated metrics from a report.
     */
    public ProjectMetrics buildMetrics(PlagiarismReport report, String projectName) {
        double threshold = report.config().threshold();
        List<PairMetrics> pairs = report.pairs().stream()
                .map(pair -> new PairMetrics(
                        pair.first().displayName(),
                        pair.second().displayName(),
                        pair.score(),
                        pair.detection().result().matchedSegments().size(),
                        pair.isFlagged(threshold)))
                .toList();

        return new ProjectMetrics(
                projectName,
                LocalDateTime.now(),
                report.files().size(),
                report.pairs().size(),
                report.getFlaggedCount(),
                threshold,
                report.getAverageScore(),
                report.getMaxScore(),
                pairs);
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ProjectMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Summary\n");
        csv.append("timestamp,project,total_files,total_pairs,flagged_pairs,threshold,avg_similarity,max_similarity\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%.2f,%.4f,%.4f\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.projectName(),
                metrics.totalFiles(),
                metrics.totalPairs(),
                metrics.flaggedPairs(),
                metrics.threshold(),
                metrics.averageSimilarity(),
                metrics.maxSimilarity()));

        csv.append("\n");

        csv.append("# Pairs\n");
        csv.append("file1,file2,similarity,segments,flagged\n");
        for (PairMetrics pair : metrics.pairs()) {
            csv.append(String.format(Locale.ROOT, "%s,%s,%.4f,%d,%s\n",
                    pair.file1(),
                    pair.file2(),
                    pair.similarity(),
                    pair.segmentCount(),
                    pair.flagged()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ProjectMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Render the full report, segments included, as pretty-printed JSON.
     */
    public String renderReport(PlagiarismReport report, String version) throws JsonProcessingException {
        double threshold = report.config().threshold();
        List<JsonPair> pairs = report.pairs().stream()
                .map(pair -> toJsonPair(pair, threshold))
                .toList();
        JsonReport json = new JsonReport(version, report.files().size(), threshold, report.getFlaggedCount(), pairs);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json);
    }

    private static JsonPair toJsonPair(PairResult pair, double threshold) {
        DetectionReport detection = pair.detection();
        List<JsonSegment> segments = detection.result().matchedSegments().stream()
                .map(segment -> toJsonSegment(detection, segment))
                .toList();
        return new JsonPair(
                pair.first().path().toString(),
                pair.second().path().toString(),
                pair.score(),
                detection.result().severity().name(),
                pair.isFlagged(threshold),
                segments);
    }

    private static JsonSegment toJsonSegment(DetectionReport detection, Segment segment) {
        Range source1 = detection.sourceRangeInFirst(segment);
        Range source2 = detection.sourceRangeInSecond(segment);
        return new JsonSegment(
                segment.start1(), segment.end1(), segment.start2(), segment.end2(),
                source1.startLine(), source1.endLine(), source2.startLine(), source2.endLine(),
                segment.lines());
    }
}
