package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * An <code>if</code> statement with an optional <code>else</code> branch.
 *
 * @param keyword The <code>if</code> keyword.
 * @param test The condition.
 * @param consequent The statement executed when the condition holds.
 * @param alternate The <code>else</code> statement, or null.
 */
public record IfNode(
        Token keyword,
        AstNode test,
        AstNode consequent,
        AstNode alternate
) implements StatementNode {

    @Override
    public Token firstToken() {
        return keyword;
    }

    @Override
    public Token lastToken() {
        return alternate != null ? alternate.lastToken() : consequent.lastToken();
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, consequent, alternate);
    }
}
