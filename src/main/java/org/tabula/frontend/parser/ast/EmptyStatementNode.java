package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

/**
 * A lone semicolon.
 *
 * @param semicolon The semicolon token.
 */
public record EmptyStatementNode(
        Token semicolon
) implements StatementNode {

    @Override
    public Token firstToken() {
        return semicolon;
    }

    @Override
    public Token lastToken() {
        return semicolon;
    }
}
