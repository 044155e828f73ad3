package com.raditha.copycheck.model;

/**
 * A single cleaned line: comments removed, whitespace collapsed and
 * identifiers replaced by placeholders.
 *
 * @param text       Normalized text (never empty)
 * @param sourceLine Line number in the raw document this line came from
 *                   (1-indexed)
 */
public record NormalizedLine(String text, int sourceLine) {

    @Override
    public String toString() {
        return sourceLine + ": " + text;
    }
}
