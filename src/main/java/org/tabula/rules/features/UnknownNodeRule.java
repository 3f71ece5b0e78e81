package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.indent.TokenIndex;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Leaves the inside of a node kind that is not checked as it is written. Runs when the
 * node is left: every token whose indentation does not follow another token of the same
 * node keeps its actual indentation when it starts a line, and follows the start of its
 * line otherwise.
 */
public class UnknownNodeRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        OffsetStorage offsets = context.offsets();
        TokenIndex tokenIndex = context.tokenIndex();

        List<Token> nodeTokens = context.tokens().tokensOf(node, true);
        Set<Integer> nodeTokenIds = new HashSet<>();
        for (Token token : nodeTokens) {
            nodeTokenIds.add(token.id());
        }

        for (Token token : nodeTokens) {
            Token dependency = offsets.firstDependency(token);
            if (dependency == null || !nodeTokenIds.contains(dependency.id())) {
                Token firstTokenOfLine = tokenIndex.firstTokenOfLine(token);
                if (token.equals(firstTokenOfLine)) {
                    offsets.ignore(token);
                } else {
                    offsets.matchIndent(firstTokenOfLine, token);
                }
            }
        }
    }
}
