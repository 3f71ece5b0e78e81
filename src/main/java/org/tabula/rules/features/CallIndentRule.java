package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.CallNode;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;
import org.tabula.rules.Punctuators;

/**
 * Indents call arguments from the opening parenthesis, which itself lines up with the
 * token in front of it.
 */
public class CallIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        CallNode call = (CallNode) node;
        TokenStream tokens = context.tokens();

        Token openingParen = call.arguments().isEmpty()
                ? tokens.lastToken(call, 1)
                : tokens.firstTokenBetween(call.callee(), call.arguments().get(0), Punctuators::isOpeningParen);
        Token closingParen = call.lastToken();

        context.markParameterParens(openingParen, closingParen);
        context.offsets().matchIndent(tokens.tokenBefore(openingParen), openingParen);
        context.elementListIndent(call.arguments(), openingParen, closingParen, context.options().callArguments());
    }
}
