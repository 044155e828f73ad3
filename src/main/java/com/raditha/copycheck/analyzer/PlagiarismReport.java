package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.config.DetectionConfig;
import com.raditha.copycheck.model.Segment;
import com.raditha.copycheck.model.SimilarityResult;

import java.util.List;
import java.util.Locale;

/**
 * Result of comparing a set of files pairwise.
 * Pairs are sorted by descending similarity.
 */
public record PlagiarismReport(
        List<SourceFile> files,
        List<PairResult> pairs,
        DetectionConfig config) {

    public PlagiarismReport {
        files = List.copyOf(files);
        pairs = List.copyOf(pairs);
    }

    /**
     * Pairs whose score reaches the configured threshold.
     */
    public List<PairResult> getFlagged() {
        return pairs.stream()
                .filter(pair -> pair.isFlagged(config.threshold()))
                .toList();
    }

    public int getFlaggedCount() {
        return getFlagged().size();
    }

    public boolean hasFlagged() {
        return pairs.stream().anyMatch(pair -> pair.isFlagged(config.threshold()));
    }

    public double getAverageScore() {
        return pairs.stream().mapToDouble(PairResult::score).average().orElse(0.0);
    }

    public double getMaxScore() {
        return pairs.stream().mapToDouble(PairResult::score).max().orElse(0.0);
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(Locale.ROOT,
                "Compared %d pairs from %d files: %d flagged at threshold %.0f%%",
                pairs.size(),
                files.size(),
                getFlaggedCount(),
                config.threshold() * 100);
    }

    /**
     * Plain-text report of every pair with its segments in raw line numbers.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("PLAGIARISM DETECTION REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Files: ").append(files.size()).append("\n");
        sb.append("Threshold: ").append(String.format(Locale.ROOT, "%.0f%%", config.threshold() * 100)).append("\n");
        sb.append("\n");

        sb.append(getSummary()).append("\n\n");

        if (pairs.isEmpty()) {
            sb.append("No pairs compared.\n");
            return sb.toString();
        }

        sb.append("Pairs (sorted by similarity):\n");
        sb.append("-".repeat(80)).append("\n\n");
        for (int i = 0; i < pairs.size(); i++) {
            PairResult pair = pairs.get(i);
            SimilarityResult result = pair.detection().result();
            sb.append(String.format(Locale.ROOT, "Pair #%d - %s vs %s - %s similar%s\n",
                    i + 1,
                    pair.first().displayName(),
                    pair.second().displayName(),
                    result.formatScore(),
                    pair.isFlagged(config.threshold()) ? " (flagged)" : ""));
            for (Segment segment : result.matchedSegments()) {
                sb.append(String.format("  Lines %s <-> %s\n",
                        pair.detection().sourceRangeInFirst(segment).toDisplayString(),
                        pair.detection().sourceRangeInSecond(segment).toDisplayString()));
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
