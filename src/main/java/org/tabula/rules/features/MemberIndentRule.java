package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.MemberNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.ElementListOffset;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;
import org.tabula.rules.Punctuators;

/**
 * Indents property accesses written on their own line, e.g.
 * <pre>
 * foo
 *     .bar
 *     .baz
 * </pre>
 * A property access continuing the line of its object is not indented.
 */
public class MemberIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        MemberNode member = (MemberNode) node;
        TokenStream tokens = context.tokens();
        OffsetStorage offsets = context.offsets();

        Token firstNonObjectToken = tokens.firstTokenBetween(member.object(), member.property(), Punctuators::isNotClosingParen);
        Token secondNonObjectToken = tokens.tokenAfter(firstNonObjectToken);

        int objectParenCount = (int) tokens.tokensBetween(member.object().lastToken(), member.property().firstToken())
                .stream()
                .filter(Punctuators::isClosingParen)
                .count();
        Token firstObjectToken = objectParenCount > 0
                ? tokens.tokenBefore(member.object().firstToken(), objectParenCount - 1)
                : member.object().firstToken();
        Token lastObjectToken = tokens.tokenBefore(firstNonObjectToken);
        Token firstPropertyToken = member.computed() ? firstNonObjectToken : secondNonObjectToken;

        if (member.computed()) {
            offsets.matchIndent(firstNonObjectToken, member.lastToken());
            offsets.declareOffsets(member.property().start(), member.property().end(), firstNonObjectToken, 1);
        }

        Token offsetBase = lastObjectToken.endLine() == firstPropertyToken.line() ? lastObjectToken : firstObjectToken;

        ElementListOffset memberOffset = context.options().memberExpression();
        if (!memberOffset.isOff()) {
            offsets.declareOffset(firstNonObjectToken, offsetBase, memberOffset.level());
            offsets.declareOffset(secondNonObjectToken, member.computed() ? firstNonObjectToken : offsetBase,
                    memberOffset.level());
        } else {
            offsets.ignore(firstNonObjectToken);
            offsets.ignore(secondNonObjectToken);

            // The property tokens depend on the ignored tokens, so they keep their indentation as well.
            offsets.matchIndent(offsetBase, firstNonObjectToken);
            offsets.matchIndent(firstNonObjectToken, secondNonObjectToken);
        }
    }
}
