package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.ast.AssignmentNode;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * Indents the right-hand side of an assignment from the last token of its target.
 */
public class AssignmentIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        AssignmentNode assignment = (AssignmentNode) node;
        OffsetStorage offsets = context.offsets();
        Token operator = assignment.operator();

        offsets.declareOffsets(operator.start(), assignment.end(), assignment.left().lastToken(), 1);
        offsets.ignore(operator);
        offsets.ignore(context.tokens().tokenAfter(operator));
    }
}
