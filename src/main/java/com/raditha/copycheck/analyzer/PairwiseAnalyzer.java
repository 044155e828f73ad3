package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.config.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Compares every unordered pair of files, N·(N-1)/2 comparisons in total,
 * one after another.
 */
public class PairwiseAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(PairwiseAnalyzer.class);

    private final DetectionConfig config;
    private final PlagiarismDetector detector;

    public PairwiseAnalyzer(DetectionConfig config) {
        this(config, new PlagiarismDetector());
    }

    public PairwiseAnalyzer(DetectionConfig config, PlagiarismDetector detector) {
        this.config = config;
        this.detector = detector;
    }

    /**
     * Compare all pairs.
     *
     * @throws IllegalArgumentException if fewer than two files are given
     */
    public PlagiarismReport analyze(List<SourceFile> files) {
        if (files.size() < 2) {
            throw new IllegalArgumentException("Need at least two files to compare, got " + files.size());
        }

        List<PairResult> pairs = new ArrayList<>(files.size() * (files.size() - 1) / 2);
        for (int i = 0; i < files.size(); i++) {
            for (int j = i + 1; j < files.size(); j++) {
                SourceFile first = files.get(i);
                SourceFile second = files.get(j);
                DetectionReport detection = detector.analyze(first.toDocument(), second.toDocument());
                logger.debug("{} vs {}: {}", first.displayName(), second.displayName(),
                        detection.result().formatScore());
                pairs.add(new PairResult(first, second, detection));
            }
        }

        pairs.sort(Comparator.comparingDouble(PairResult::score).reversed());

        PlagiarismReport report = new PlagiarismReport(files, pairs, config);
        logger.info(report.getSummary());
        return report;
    }
}
