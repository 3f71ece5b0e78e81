package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A <code>return</code> statement.
 *
 * @param keyword The <code>return</code> keyword.
 * @param argument The returned value, or null.
 * @param last The last token of the statement.
 */
public record ReturnNode(
        Token keyword,
        AstNode argument,
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
        return Children.of(argument);
    }
}
