package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A named function declaration.
 *
 * @param keyword The <code>function</code> keyword.
 * @param name The function name.
 * @param params The parameters.
 * @param body The body.
 */
public record FunctionDeclarationNode(
        Token keyword,
        Token name,
        List<IdentifierNode> params,
        BlockNode body
) implements StatementNode, FunctionLikeNode {

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
