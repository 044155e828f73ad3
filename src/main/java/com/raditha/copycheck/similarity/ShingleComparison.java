package com.raditha.copycheck.similarity;

import com.raditha.copycheck.model.MatchedShingle;

import java.util.List;

/**
 * Jaccard score of two shingle indices and the digests they share.
 *
 * @param similarity       intersection / union, 0.0 when the union is empty
 * @param matchedShingles  shared digests in the first index's order
 * @param intersectionSize number of distinct shared digests
 * @param unionSize        number of distinct digests across both indices
 */
public record ShingleComparison(
        double similarity,
        List<MatchedShingle> matchedShingles,
        int intersectionSize,
        int unionSize) {

    public ShingleComparison {
        matchedShingles = List.copyOf(matchedShingles);
    }
}
