package com.raditha.copycheck.model;

import java.util.List;
import java.util.Locale;

/**
 * Outcome of comparing two documents.
 * The engine never applies a threshold; {@link #exceedsThreshold(double)} is
 * there for callers that flag results.
 *
 * @param similarityScore  Jaccard similarity over distinct shingle digests
 *                         (0.0-1.0)
 * @param matchedSegments  merged segments ordered by start in document 1
 */
public record SimilarityResult(double similarityScore, List<Segment> matchedSegments) {

    public SimilarityResult {
        if (similarityScore < 0.0 || similarityScore > 1.0) {
            throw new IllegalArgumentException("similarityScore must be between 0.0 and 1.0");
        }
        matchedSegments = List.copyOf(matchedSegments);
    }

    public static SimilarityResult empty() {
        return new SimilarityResult(0.0, List.of());
    }

    /**
     * Check if similarity reaches a threshold.
     */
    public boolean exceedsThreshold(double threshold) {
        return similarityScore >= threshold;
    }

    /**
     * Get similarity percentage (0-100).
     */
    public double getSimilarityPercentage() {
        return similarityScore * 100.0;
    }

    /**
     * Format score as percentage string.
     */
    public String formatScore() {
        return String.format(Locale.ROOT, "%.1f%%", getSimilarityPercentage());
    }

    public Severity severity() {
        return Severity.of(similarityScore);
    }

    /**
     * Display band for a score.
     */
    public enum Severity {
        HIGH(0.90),
        MEDIUM(0.70),
        LOW(0.50),
        NONE(0.0);

        private final double floor;

        Severity(double floor) {
            this.floor = floor;
        }

        public static Severity of(double score) {
            for (Severity severity : values()) {
                if (score >= severity.floor) {
                    return severity;
                }
            }
            return NONE;
        }
    }
}
