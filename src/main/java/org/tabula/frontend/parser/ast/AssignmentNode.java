package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * An assignment, <code>target = value</code> (also <code>+=</code> and <code>-=</code>).
 *
 * @param left The assigned target.
 * @param operator The assignment operator.
 * @param right The assigned value.
 * @param first The first token of the expression.
 * @param last The last token of the expression.
 */
public record AssignmentNode(
        AstNode left,
        Token operator,
        AstNode right,
        Token first,
        Token last
) implements AstNode {

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
        return Children.of(left, right);
    }
}
