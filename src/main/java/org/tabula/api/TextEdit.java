package org.tabula.api;

/**
 * Replaces the characters {@code [start, end)} of a text.
 *
 * @param start The first replaced offset.
 * @param end The offset just past the replaced characters.
 * @param replacement The new text.
 */
public record TextEdit(int start, int end, String replacement) {

    public TextEdit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ")");
        }
    }
}
