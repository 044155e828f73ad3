package com.raditha.copycheck.segment;

import com.raditha.copycheck.model.MatchedShingle;
import com.raditha.copycheck.model.Segment;
import com.raditha.copycheck.shingle.ShingleIndexer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns shared shingles into line-range segments and merges the ones that
 * touch or overlap in the first document.
 * <p>
 * Merging looks at first-document coordinates only. The second document's
 * range becomes the min start / max end of everything merged, so it can be
 * looser than the actual matching lines.
 */
public class SegmentBuilder {

    private final int shingleSize;

    public SegmentBuilder() {
        this(ShingleIndexer.SHINGLE_SIZE);
    }

    public SegmentBuilder(int shingleSize) {
        if (shingleSize < 1) {
            throw new IllegalArgumentException("shingleSize must be >= 1");
        }
        this.shingleSize = shingleSize;
    }

    public List<Segment> buildSegments(List<MatchedShingle> matchedShingles, List<String> normalizedLinesA) {
        return merge(expand(matchedShingles, normalizedLinesA));
    }

    /**
     * One raw segment per (position in A, position in B) pair of every
     * matched shingle.
     */
    public List<Segment> expand(List<MatchedShingle> matchedShingles, List<String> normalizedLinesA) {
        List<Segment> raw = new ArrayList<>();
        for (MatchedShingle shingle : matchedShingles) {
            for (int p1 : shingle.positions1()) {
                List<String> lines = normalizedLinesA.subList(p1, Math.min(p1 + shingleSize, normalizedLinesA.size()));
                for (int p2 : shingle.positions2()) {
                    raw.add(new Segment(p1, p1 + shingleSize - 1, p2, p2 + shingleSize - 1, lines));
                }
            }
        }
        return raw;
    }

    /**
     * Greedy merge in ascending start order of the first document.
     * Line texts are unioned in first-seen order.
     */
    public List<Segment> merge(List<Segment> rawSegments) {
        if (rawSegments.size() <= 1) {
            return List.copyOf(rawSegments);
        }

        List<Segment> sorted = new ArrayList<>(rawSegments);
        sorted.sort(Comparator.comparingInt(Segment::start1));

        List<Segment> merged = new ArrayList<>();
        Segment current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            Segment next = sorted.get(i);
            if (next.start1() <= current.end1() + 1) {
                current = combine(current, next);
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    private static Segment combine(Segment current, Segment next) {
        Set<String> lines = new LinkedHashSet<>(current.lines());
        lines.addAll(next.lines());
        return new Segment(
                Math.min(current.start1(), next.start1()),
                Math.max(current.end1(), next.end1()),
                Math.min(current.start2(), next.start2()),
                Math.max(current.end2(), next.end2()),
                new ArrayList<>(lines));
    }
}
