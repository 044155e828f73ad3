package com.raditha.copycheck.model;

import java.util.List;

/**
 * Ordered normalized lines of one document.
 * Indices into this sequence do not line up with raw line numbers because
 * blank and comment-only lines are dropped; use {@link #sourceLineOf(int)} to
 * map back.
 *
 * @param lines normalized lines in document order
 */
public record NormalizedDocument(List<NormalizedLine> lines) {

    public NormalizedDocument {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static NormalizedDocument empty() {
        return new NormalizedDocument(List.of());
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Raw (1-indexed) line number of the normalized line at the given index.
     */
    public int sourceLineOf(int index) {
        return lines.get(index).sourceLine();
    }

    /**
     * Just the normalized texts, in order.
     */
    public List<String> texts() {
        return lines.stream().map(NormalizedLine::text).toList();
    }
}
