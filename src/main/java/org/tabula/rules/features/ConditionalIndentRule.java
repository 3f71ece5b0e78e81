package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.ConditionalNode;
import org.tabula.frontend.parser.ast.StatementNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * Indents the branches of a conditional expression one level from its first token.
 * <p>
 * With flat ternaries enabled, a conditional whose test and consequent share a line and
 * which does not open a statement declares nothing, so chains like
 * <pre>
 * var a =
 *     foo > 0 ? bar :
 *     foo &lt; 0 ? baz :
 *     qiz;
 * </pre>
 * stay flat.
 */
public class ConditionalIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        ConditionalNode conditional = (ConditionalNode) node;
        Token firstToken = conditional.firstToken();

        boolean flat = context.options().flatTernaryExpressions()
                && conditional.test().lastToken().endLine() == conditional.consequent().firstToken().line()
                && !isFirstTokenOfStatement(firstToken, conditional, context);
        if (flat) {
            return;
        }

        TokenStream tokens = context.tokens();
        OffsetStorage offsets = context.offsets();
        Token questionMark = conditional.question();
        Token colon = conditional.colon();
        Token firstConsequentToken = tokens.tokenOrCommentAfter(questionMark);
        Token lastConsequentToken = tokens.tokenOrCommentBefore(colon);
        Token firstAlternateToken = tokens.tokenAfter(colon);

        offsets.declareOffset(questionMark, firstToken, 1);
        offsets.declareOffset(colon, firstToken, 1);
        offsets.declareOffset(firstConsequentToken, firstToken, 1);

        // Branches sharing a line line up with each other, otherwise both hang off the test.
        if (lastConsequentToken.endLine() == firstAlternateToken.line()) {
            offsets.matchIndent(firstConsequentToken, firstAlternateToken);
        } else {
            offsets.declareOffset(firstAlternateToken, firstToken, 1);
        }

        offsets.declareOffsets(questionMark.end(), colon.start(), firstConsequentToken, 0);
        offsets.declareOffsets(colon.end(), conditional.end(), firstAlternateToken, 0);
    }

    private static boolean isFirstTokenOfStatement(Token token, AstNode leaf, IndentContext context) {
        AstNode node = leaf;
        while (context.parentOf(node) != null && !(context.parentOf(node) instanceof StatementNode)) {
            node = context.parentOf(node);
        }
        AstNode statement = context.parentOf(node);
        return statement == null || statement.start() == token.start();
    }
}
