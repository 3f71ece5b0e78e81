package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

/**
 * A number, string, template, boolean or null literal.
 *
 * @param token The literal token.
 */
public record LiteralNode(
        Token token
) implements AstNode {

    @Override
    public Token firstToken() {
        return token;
    }

    @Override
    public Token lastToken() {
        return token;
    }
}
