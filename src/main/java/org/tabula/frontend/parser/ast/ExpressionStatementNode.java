package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * An expression used as a statement.
 *
 * @param expression The expression.
 * @param first The first token of the statement (may be a parenthesis).
 * @param last The last token of the statement (the semicolon if present).
 */
public record ExpressionStatementNode(
        AstNode expression,
        Token first,
        Token last
) implements StatementNode {

    @Override
    public Token firstToken() {
        return first;
    }

    @Override
    public Token lastToken() {
        return last;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(expression);
    }
}
