package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * An array literal, <code>[a, b]</code>.
 *
 * @param open The opening bracket.
 * @param elements The elements.
 * @param close The closing bracket.
 */
public record ArrayNode(
        Token open,
        List<AstNode> elements,
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
        return elements;
    }
}
