package com.raditha.copycheck.model;

import java.util.List;

/**
 * Raw source document as supplied by the caller.
 * Immutable once created.
 *
 * @param lines raw lines in file order, without line terminators
 */
public record Document(List<String> lines) {

    public Document {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Split text into lines on any line terminator.
     * A null or empty text yields an empty document.
     */
    public static Document of(String text) {
        if (text == null || text.isEmpty()) {
            return new Document(List.of());
        }
        return new Document(List.of(text.split("\\R", -1)));
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
