package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A <code>do ... while (...)</code> loop.
 *
 * @param keyword The <code>do</code> keyword.
 * @param body The loop body.
 * @param test The loop condition.
 * @param last The closing parenthesis or the trailing semicolon.
 */
public record DoWhileNode(
        Token keyword,
        AstNode body,
        AstNode test,
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

    @Override
    public List<AstNode> getChildren() {
        return Children.of(body, test);
    }
}
