package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A call, <code>callee(arg, ...)</code>.
 *
 * @param callee The called expression.
 * @param arguments The arguments.
 * @param first The first token of the call.
 * @param last The closing parenthesis.
 */
public record CallNode(
        AstNode callee,
        List<AstNode> arguments,
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
        return Children.of(callee, arguments);
    }
}
