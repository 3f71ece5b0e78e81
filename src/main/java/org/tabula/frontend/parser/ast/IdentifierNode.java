package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

/**
 * An AST node that represents an identifier.
 *
 * @param token The token of the identifier.
 */
public record IdentifierNode(
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
