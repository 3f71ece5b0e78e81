package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.VariableDeclaratorNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;
import org.tabula.rules.Punctuators;

/**
 * Indents a declarator's initializer from its <code>=</code>.
 */
public class VariableDeclaratorIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        VariableDeclaratorNode declarator = (VariableDeclaratorNode) node;
        if (declarator.init() == null) {
            return;
        }
        OffsetStorage offsets = context.offsets();
        Token equalOperator = context.tokens().tokenBefore(declarator.init(), Punctuators::isNotOpeningParen);
        Token tokenAfterOperator = context.tokens().tokenAfter(equalOperator);

        offsets.ignore(equalOperator);
        offsets.ignore(tokenAfterOperator);
        offsets.declareOffsets(tokenAfterOperator.start(), declarator.end(), equalOperator, 1);
        offsets.matchIndent(declarator.id().lastToken(), equalOperator);
    }
}
