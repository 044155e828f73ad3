package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.model.Document;
import com.raditha.copycheck.model.NormalizedDocument;
import com.raditha.copycheck.model.Segment;
import com.raditha.copycheck.model.SimilarityResult;
import com.raditha.copycheck.normalization.SourceNormalizer;
import com.raditha.copycheck.segment.SegmentBuilder;
import com.raditha.copycheck.shingle.ShingleIndex;
import com.raditha.copycheck.shingle.ShingleIndexer;
import com.raditha.copycheck.similarity.JaccardScorer;
import com.raditha.copycheck.similarity.ShingleComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compares two source documents for structural similarity.
 * <p>
 * Pipeline: normalize each document, index its 3-line shingles, score the
 * two indices with Jaccard similarity, then expand and merge the shared
 * shingles into segments.
 * <p>
 * Instances hold no per-comparison state and may be shared between threads.
 */
public class PlagiarismDetector {

    private static final Logger logger = LoggerFactory.getLogger(PlagiarismDetector.class);

    private final SourceNormalizer normalizer;
    private final ShingleIndexer indexer;
    private final JaccardScorer scorer;
    private final SegmentBuilder segmentBuilder;

    public PlagiarismDetector() {
        this(new SourceNormalizer(), new ShingleIndexer(), new JaccardScorer(), new SegmentBuilder());
    }

    public PlagiarismDetector(SourceNormalizer normalizer, ShingleIndexer indexer,
            JaccardScorer scorer, SegmentBuilder segmentBuilder) {
        this.normalizer = normalizer;
        this.indexer = indexer;
        this.scorer = scorer;
        this.segmentBuilder = segmentBuilder;
    }

    /**
     * Compare two source texts.
     *
     * @param sourceA   first document text (null is treated as empty)
     * @param sourceB   second document text (null is treated as empty)
     * @param threshold display threshold of the caller; accepted for signature
     *                  compatibility and not applied here
     * @return similarity score and matched segments in normalized-line
     *         coordinates
     */
    public SimilarityResult detect(String sourceA, String sourceB, double threshold) {
        logger.debug("Comparing documents (caller threshold {})", threshold);
        return analyze(Document.of(sourceA), Document.of(sourceB)).result();
    }

    /**
     * Compare two documents and keep their normalized forms.
     */
    public DetectionReport analyze(Document first, Document second) {
        NormalizedDocument normalizedFirst = normalizer.normalize(first);
        NormalizedDocument normalizedSecond = normalizer.normalize(second);

        ShingleIndex indexFirst = indexer.index(normalizedFirst);
        ShingleIndex indexSecond = indexer.index(normalizedSecond);

        ShingleComparison comparison = scorer.score(indexFirst, indexSecond);
        List<Segment> segments = segmentBuilder.buildSegments(
                comparison.matchedShingles(), normalizedFirst.texts());

        logger.debug("Shingles: {} vs {} distinct, intersection {}, union {}, {} segments",
                indexFirst.size(), indexSecond.size(),
                comparison.intersectionSize(), comparison.unionSize(), segments.size());

        return new DetectionReport(
                new SimilarityResult(comparison.similarity(), segments),
                normalizedFirst,
                normalizedSecond);
    }
}
