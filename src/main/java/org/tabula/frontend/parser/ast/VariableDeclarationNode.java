package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A <code>var</code>, <code>let</code> or <code>const</code> declaration.
 *
 * @param kind The declaration keyword.
 * @param declarations The declarators in source order.
 * @param last The last token of the declaration (the semicolon if present).
 */
public record VariableDeclarationNode(
        Token kind,
        List<VariableDeclaratorNode> declarations,
        Token last
) implements StatementNode {

    @Override
    public Token firstToken() {
        return kind;
    }

    @Override
    public Token lastToken() {
        return last;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(declarations);
    }
}
