package com.lexgate.core.detect;

/**
 * Replacement of the characters in {@code [begin, end)} of a file's content.
 */
public record TextEdit(int begin, int end, String replacement) {

    public TextEdit {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("Invalid edit range " + begin + ".." + end);
        }
    }

    public static TextEdit insert(int offset, String text) {
        return new TextEdit(offset, offset, text);
    }
}
