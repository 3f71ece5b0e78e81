package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.FunctionDeclarationNode;
import org.tabula.frontend.parser.ast.FunctionLikeNode;
import org.tabula.rules.ElementListOffset;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * Indents the parameter list of function declarations and expressions.
 */
public class FunctionIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        FunctionLikeNode function = (FunctionLikeNode) node;
        TokenStream tokens = context.tokens();

        Token closingParen = tokens.tokenBefore(function.body());
        Token openingParen = function.params().isEmpty()
                ? tokens.tokenBefore(closingParen)
                : tokens.tokenBefore(function.params().get(0));

        ElementListOffset offset = function instanceof FunctionDeclarationNode
                ? context.options().functionDeclarationParameters()
                : context.options().functionExpressionParameters();

        context.markParameterParens(openingParen, closingParen);
        context.elementListIndent(function.params(), openingParen, closingParen, offset);
    }
}
