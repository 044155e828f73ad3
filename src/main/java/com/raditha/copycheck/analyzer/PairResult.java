package com.raditha.copycheck.analyzer;

/**
 * Comparison of one unordered pair of files.
 *
 * @param first     first file of the pair
 * @param second    second file of the pair
 * @param detection similarity result with the normalized documents
 */
public record PairResult(SourceFile first, SourceFile second, DetectionReport detection) {

    public double score() {
        return detection.score();
    }

    public boolean isFlagged(double threshold) {
        return detection.result().exceedsThreshold(threshold);
    }
}
