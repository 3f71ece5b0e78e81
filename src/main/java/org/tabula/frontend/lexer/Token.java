package org.tabula.frontend.lexer;

/**
 * Represents a single token (or comment) extracted from the source code by the {@link Lexer}.
 * <p>
 * Tokens are compared by value, but the {@code id} is unique within one file, so two
 * distinct tokens are never equal.
 *
 * @param id Dense index of the token in source order, comments included.
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param start Offset of the first character of the token.
 * @param end Offset just past the last character of the token.
 * @param line The 1-based line on which the token starts.
 * @param column The 0-based column on which the token starts.
 * @param endLine The 1-based line on which the token ends.
 * @param endColumn The 0-based column just past the token's last character.
 * @param fileName The logical file name the token comes from.
 */
public record Token(
        int id,
        TokenType type,
        String text,
        int start,
        int end,
        int line,
        int column,
        int endLine,
        int endColumn,
        String fileName
) {

    /**
     * @return true if this token is a line or block comment.
     */
    public boolean isComment() {
        return type.isComment();
    }

    /**
     * Checks the token type and text at once, e.g. {@code is(TokenType.OPERATOR, "=")}.
     * @param expectedType The expected type.
     * @param expectedText The expected text.
     * @return true if both match.
     */
    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return String.format("'%s' (%d:%d)", text, line, column + 1);
    }
}
