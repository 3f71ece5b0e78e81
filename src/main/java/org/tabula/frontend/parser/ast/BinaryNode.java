package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * An arithmetic, comparison or logical operation, <code>left op right</code>.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 * @param first The first token of the expression.
 * @param last The last token of the expression.
 */
public record BinaryNode(
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
