package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.BinaryNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * Binary and logical operators. The operator and the token after it keep whatever
 * indentation they have; the rest of the right operand follows that token.
 */
public class BinaryIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        BinaryNode binary = (BinaryNode) node;
        OffsetStorage offsets = context.offsets();
        Token operator = binary.operator();
        Token tokenAfterOperator = context.tokens().tokenAfter(operator);

        offsets.ignore(operator);
        offsets.ignore(tokenAfterOperator);
        offsets.declareOffset(tokenAfterOperator, operator, 0);
        offsets.declareOffsets(tokenAfterOperator.end(), binary.end(), tokenAfterOperator, 1);
    }
}
