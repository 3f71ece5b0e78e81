package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A function used as a value.
 *
 * @param keyword The <code>function</code> keyword.
 * @param name The optional function name, or null.
 * @param params The parameters.
 * @param body The body.
 */
public record FunctionExpressionNode(
        Token keyword,
        Token name,
        List<IdentifierNode> params,
        BlockNode body
) implements FunctionLikeNode {

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
        return Children.of(params, body);
    }
}
