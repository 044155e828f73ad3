package com.raditha.copycheck.model;

import java.util.List;

/**
 * A digest present in both documents, with the window start positions that
 * produced it on each side.
 *
 * @param digest     the shared digest
 * @param positions1 window starts in the first document, ascending
 * @param positions2 window starts in the second document, ascending
 */
public record MatchedShingle(Digest digest, List<Integer> positions1, List<Integer> positions2) {

    public MatchedShingle {
        positions1 = List.copyOf(positions1);
        positions2 = List.copyOf(positions2);
    }

    /**
     * Number of raw segments this shingle expands into (full cross product).
     */
    public int pairCount() {
        return positions1.size() * positions2.size();
    }
}
