package com.raditha.copycheck.model;

/**
 * Inclusive line range.
 *
 * @param startLine first line of the range
 * @param endLine   last line of the range (inclusive)
 */
public record Range(int startLine, int endLine) {

    public Range {
        if (startLine > endLine) {
            throw new IllegalArgumentException(
                    String.format("Range start %d is after end %d", startLine, endLine));
        }
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
