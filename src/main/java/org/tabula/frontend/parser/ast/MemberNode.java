package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A property access, <code>object.property</code> or <code>object[property]</code>.
 *
 * @param object The accessed object.
 * @param property The property (an identifier when not computed).
 * @param computed Whether the bracket form is used.
 * @param first The first token of the expression.
 * @param last The last token of the expression.
 */
public record MemberNode(
        AstNode object,
        AstNode property,
        boolean computed,
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
        return Children.of(object, property);
    }
}
