package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A classic three-part <code>for</code> loop. Each header part may be absent.
 *
 * @param keyword The <code>for</code> keyword.
 * @param init The initializer (a declaration or an expression), or null.
 * @param test The condition, or null.
 * @param update The update expression, or null.
 * @param body The loop body.
 */
public record ForNode(
        Token keyword,
        AstNode init,
        AstNode test,
        AstNode update,
        AstNode body
) implements StatementNode {

    @Override
    public Token firstToken() {
        return keyword;
    }

    @Override
    public Token lastToken() {
        return body.lastToken();
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(init, test, update, body);
    }
}
