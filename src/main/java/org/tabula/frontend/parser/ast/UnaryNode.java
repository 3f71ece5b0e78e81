package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A prefix or postfix unary operation such as <code>!a</code> or <code>i++</code>.
 *
 * @param operator The operator token.
 * @param argument The operand.
 * @param prefix Whether the operator precedes the operand.
 * @param first The first token of the expression.
 * @param last The last token of the expression.
 */
public record UnaryNode(
        Token operator,
        AstNode argument,
        boolean prefix,
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
        return Children.of(argument);
    }
}
