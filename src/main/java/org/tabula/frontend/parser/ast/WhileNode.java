package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A <code>while</code> loop.
 *
 * @param keyword The <code>while</code> keyword.
 * @param test The loop condition.
 * @param body The loop body.
 */
public record WhileNode(
        Token keyword,
        AstNode test,
        AstNode body
) implements StatementNode {

    @Override
    public Token firstToken() {
        return keyword;
    }

    @Override
    public Token lastToken() {
        return body.lastToken();
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, body);
    }
}
