package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * Common shape of function declarations and function expressions.
 */
public interface FunctionLikeNode extends AstNode {

    /**
     * @return The optional name of the function, may be null for expressions.
     */
    Token name();

    /**
     * @return The declared parameters.
     */
    List<IdentifierNode> params();

    /**
     * @return The function body.
     */
    BlockNode body();
}
