package org.tabula.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Single-character tokens.
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '{' character. */
    LEFT_BRACE,
    /** The '}' character. */
    RIGHT_BRACE,
    /** The '[' character. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ',' character. */
    COMMA,
    /** The ';' character. */
    SEMICOLON,
    /** The ':' character, used in properties, cases and conditionals. */
    COLON,
    /** The '.' character, used in member expressions. */
    DOT,
    /** The '?' character, used in conditionals. */
    QUESTION,

    // Operators.
    /** An arithmetic, comparison, logical or assignment operator, such as '+' or '&&'. */
    OPERATOR,

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** A reserved word, such as 'if' or 'function'. */
    KEYWORD,
    /** A numeric literal. */
    NUMBER,
    /** A single or double quoted string literal. */
    STRING,
    /** A back-tick template string, which may span several lines. */
    TEMPLATE,

    // Comments.
    /** A comment running to the end of the line. */
    LINE_COMMENT,
    /** A block comment, which may span several lines. */
    BLOCK_COMMENT,

    // Miscellaneous.
    /** Represents the end of the source file. */
    END_OF_FILE;

    /**
     * @return true for both comment types.
     */
    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }
}
