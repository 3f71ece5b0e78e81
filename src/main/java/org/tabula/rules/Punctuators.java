package org.tabula.rules;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.lexer.TokenType;

/**
 * Token tests shared by the rules.
 */
public final class Punctuators {

    private Punctuators() {}

    public static boolean isOpeningParen(Token token) {
        return token != null && token.type() == TokenType.LEFT_PAREN;
    }

    public static boolean isNotOpeningParen(Token token) {
        return !isOpeningParen(token);
    }

    public static boolean isClosingParen(Token token) {
        return token != null && token.type() == TokenType.RIGHT_PAREN;
    }

    public static boolean isNotClosingParen(Token token) {
        return !isClosingParen(token);
    }

    public static boolean isOpeningBrace(Token token) {
        return token != null && token.type() == TokenType.LEFT_BRACE;
    }

    public static boolean isSemicolon(Token token) {
        return token != null && token.type() == TokenType.SEMICOLON;
    }
}
