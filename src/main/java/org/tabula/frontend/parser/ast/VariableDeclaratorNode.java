package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * One <code>name = init</code> part of a variable declaration.
 *
 * @param id The declared name.
 * @param init The initializer, or null.
 * @param last The last token of the declarator.
 */
public record VariableDeclaratorNode(
        IdentifierNode id,
        AstNode init,
        Token last
) implements AstNode {

    @Override
    public Token firstToken() {
        return id.firstToken();
    }

    @Override
    public Token lastToken() {
        return last;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(id, init);
    }
}
