package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * An object literal, <code>{ key: value }</code>.
 *
 * @param open The opening brace.
 * @param properties The properties.
 * @param close The closing brace.
 */
public record ObjectNode(
        Token open,
        List<PropertyNode> properties,
        Token close
) implements AstNode {

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
        return Children.of(properties);
    }
}
