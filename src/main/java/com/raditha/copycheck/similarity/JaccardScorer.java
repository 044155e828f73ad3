package com.raditha.copycheck.similarity;

import com.raditha.copycheck.model.Digest;
import com.raditha.copycheck.model.MatchedShingle;
import com.raditha.copycheck.shingle.ShingleIndex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Jaccard similarity over the sets of distinct shingle digests.
 * A shingle repeated inside one document counts once.
 * Jaccard = |A ∩ B| / |A ∪ B|
 */
public class JaccardScorer {

    public ShingleComparison score(ShingleIndex first, ShingleIndex second) {
        List<MatchedShingle> matched = new ArrayList<>();
        Set<Digest> union = new HashSet<>(first.digests());
        union.addAll(second.digests());

        for (Digest digest : first.digests()) {
            if (second.contains(digest)) {
                matched.add(new MatchedShingle(digest, first.positionsOf(digest), second.positionsOf(digest)));
            }
        }

        double similarity = union.isEmpty() ? 0.0 : (double) matched.size() / union.size();
        return new ShingleComparison(similarity, matched, matched.size(), union.size());
    }
}
