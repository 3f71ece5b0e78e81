package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.ForNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * Indents the three header parts of a <code>for</code> loop from its parenthesis, and
 * a body written without braces.
 */
public class ForIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        ForNode loop = (ForNode) node;
        OffsetStorage offsets = context.offsets();
        Token openingParen = context.tokens().firstToken(loop, 1);

        for (AstNode part : new AstNode[] {loop.init(), loop.test(), loop.update()}) {
            if (part != null) {
                offsets.declareOffsets(part.start(), part.end(), openingParen, 1);
            }
        }
        context.blocklessBodyIndent(loop.body());
    }
}
