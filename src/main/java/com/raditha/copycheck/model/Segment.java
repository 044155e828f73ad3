package com.raditha.copycheck.model;

import java.util.List;

/**
 * Line ranges in both documents believed to correspond, plus the matched
 * normalized lines of the first document.
 * <p>
 * All indices address the normalized line sequences (0-indexed, inclusive).
 * The second document's range is widened opportunistically when segments are
 * merged and may cover lines that are not contiguous matches.
 *
 * @param start1 first normalized line in document 1
 * @param end1   last normalized line in document 1
 * @param start2 first normalized line in document 2
 * @param end2   last normalized line in document 2
 * @param lines  normalized texts from document 1 covered by the match
 */
public record Segment(int start1, int end1, int start2, int end2, List<String> lines) {

    public Segment {
        if (start1 > end1 || start2 > end2) {
            throw new IllegalArgumentException(String.format(
                    "Segment bounds out of order: %d-%d / %d-%d", start1, end1, start2, end2));
        }
        lines = List.copyOf(lines);
    }

    public Range firstRange() {
        return new Range(start1, end1);
    }

    public Range secondRange() {
        return new Range(start2, end2);
    }
}
