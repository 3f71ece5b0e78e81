package org.tabula.indent;

import org.tabula.frontend.lexer.Token;

/**
 * The offset rule governing a range of positions: the tokens in the range are indented
 * {@code offsetLevel} units beyond their {@code anchor}.
 *
 * @param offsetLevel The number of indentation units added to the anchor's indentation.
 * @param anchor The token the range is indented from, or null for the file's left margin.
 * @param forced Whether the offset applies even to tokens on the anchor's own line.
 */
public record OffsetDescriptor(int offsetLevel, Token anchor, boolean forced) {

    /** The descriptor governing every position before anything is declared. */
    public static final OffsetDescriptor TOP_LEVEL = new OffsetDescriptor(0, null, false);

    public OffsetDescriptor {
        if (offsetLevel < 0) {
            throw new IllegalArgumentException("Offset level must not be negative: " + offsetLevel);
        }
    }
}
