package com.luacomposer.core.ast;

/**
 * Location of a syntax node in the text it was parsed from.
 *
 * @param start offset of the first character (inclusive)
 * @param end offset after the last character (exclusive)
 * @param line 1-based line of {@code start}
 * @param column 0-based column of {@code start}
 */
public record SourceSpan(int start, int end, int line, int column) {

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Checks whether this span fully covers another one.
     *
     * @param other span to test
     * @return true if {@code other} lies inside this span
     */
    public boolean contains(SourceSpan other) {
        return start <= other.start && other.end <= end;
    }

    public int length() {
        return end - start;
    }
}
