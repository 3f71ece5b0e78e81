package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A <code>key: value</code> pair inside an object literal.
 *
 * @param key The key (identifier or literal).
 * @param colon The colon between key and value.
 * @param value The value.
 * @param last The last token of the property.
 */
public record PropertyNode(
        AstNode key,
        Token colon,
        AstNode value,
        Token last
) implements AstNode {

    @Override
    public Token firstToken() {
        return key.firstToken();
    }

    @Override
    public Token lastToken() {
        return last;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(key, value);
    }
}
