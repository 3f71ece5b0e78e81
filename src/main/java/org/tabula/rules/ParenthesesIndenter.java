package org.tabula.rules;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.indent.OffsetStorage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs after the tree walk. Tokens inside grouping parentheses that do not already
 * depend on another token inside the same parentheses are indented one level from the
 * opening parenthesis, and every closing parenthesis lines up with its opening one.
 * Parameter and argument parentheses keep their contents as the rules declared them.
 */
public final class ParenthesesIndenter {

    /**
     * @param context The context of the walk that has just finished.
     */
    public void apply(IndentContext context) {
        TokenStream tokens = context.tokens();
        OffsetStorage offsets = context.offsets();

        for (Token[] pair : parenPairs(tokens.codeTokens())) {
            Token leftParen = pair[0];
            Token rightParen = pair[1];

            if (!context.isParameterParen(leftParen) && !context.isParameterParen(rightParen)) {
                List<Token> parenthesized = tokens.tokensBetween(leftParen, rightParen);
                Set<Integer> parenthesizedIds = new HashSet<>();
                for (Token token : parenthesized) {
                    parenthesizedIds.add(token.id());
                }
                for (Token token : parenthesized) {
                    Token dependency = offsets.firstDependency(token);
                    if (dependency == null || !parenthesizedIds.contains(dependency.id())) {
                        offsets.declareOffset(token, leftParen, 1);
                    }
                }
            }
            offsets.matchIndent(leftParen, rightParen);
        }
    }

    /**
     * @return The matching parenthesis pairs, the last closed pair first.
     */
    private static List<Token[]> parenPairs(List<Token> codeTokens) {
        Deque<Token> open = new ArrayDeque<>();
        List<Token[]> pairs = new ArrayList<>();
        for (Token token : codeTokens) {
            if (Punctuators.isOpeningParen(token)) {
                open.push(token);
            } else if (Punctuators.isClosingParen(token) && !open.isEmpty()) {
                pairs.add(0, new Token[] {open.pop(), token});
            }
        }
        return pairs;
    }
}
