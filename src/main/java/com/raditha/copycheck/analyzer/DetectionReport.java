package com.raditha.copycheck.analyzer;

import com.raditha.copycheck.model.NormalizedDocument;
import com.raditha.copycheck.model.Range;
import com.raditha.copycheck.model.Segment;
import com.raditha.copycheck.model.SimilarityResult;

/**
 * Similarity result together with the normalized documents it indexes into,
 * so segment positions can be mapped back to raw line numbers.
 *
 * @param result similarity score and merged segments
 * @param first  normalized form of the first document
 * @param second normalized form of the second document
 */
public record DetectionReport(
        SimilarityResult result,
        NormalizedDocument first,
        NormalizedDocument second) {

    public double score() {
        return result.similarityScore();
    }

    /**
     * Raw (1-indexed) line range in the first document covered by a segment.
     */
    public Range sourceRangeInFirst(Segment segment) {
        return new Range(first.sourceLineOf(segment.start1()), first.sourceLineOf(segment.end1()));
    }

    /**
     * Raw (1-indexed) line range in the second document covered by a segment.
     */
    public Range sourceRangeInSecond(Segment segment) {
        return new Range(second.sourceLineOf(segment.start2()), second.sourceLineOf(segment.end2()));
    }
}
