package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A braced statement list, <code>{ ... }</code>.
 *
 * @param open The opening brace.
 * @param body The statements inside the braces.
 * @param close The closing brace.
 */
public record BlockNode(
        Token open,
        List<AstNode> body,
        Token close
) implements StatementNode {

    @Override
    public Token firstToken() {
        return open;
    }

    @Override
    public Token lastToken() {
        return close;
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
