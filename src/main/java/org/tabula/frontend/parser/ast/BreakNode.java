package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

/**
 * A <code>break</code> or <code>continue</code> statement.
 *
 * @param keyword The keyword.
 * @param last The last token of the statement.
 */
public record BreakNode(
        Token keyword,
        Token last
) implements StatementNode {

    @Override
    public Token firstToken() {
        return keyword;
    }

    @Override
    public Token lastToken() {
        return last;
    }
}
