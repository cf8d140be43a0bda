package com.luacomposer.core.sanitizer;

import java.util.Comparator;

/**
 * Replacement of the text range {@code [start, end)}.
 */
record TextEdit(int start, int end, String replacement) {

    static final Comparator<TextEdit> BY_POSITION = Comparator
        .comparingInt(TextEdit::start)
        .thenComparing(Comparator.comparingInt(TextEdit::end).reversed());

    TextEdit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ")");
        }
    }

    boolean isDeletion() {
        return replacement.isEmpty();
    }

    boolean contains(TextEdit other) {
        return start <= other.start && other.end <= end;
    }
}
