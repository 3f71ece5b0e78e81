package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.TokenStream;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.BlockNode;
import org.tabula.frontend.parser.ast.SwitchCaseNode;
import org.tabula.frontend.parser.ast.SwitchNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;
import org.tabula.rules.Punctuators;

import java.util.List;

/**
 * Indents <code>case</code> clauses by the configured switch-case level and their
 * statements one level further. A clause whose only statement is a block leaves the
 * block to the block rule. Comments after the last clause are not checked.
 */
public class SwitchIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        SwitchNode switchNode = (SwitchNode) node;
        TokenStream tokens = context.tokens();
        OffsetStorage offsets = context.offsets();

        Token openingCurly = tokens.tokenAfter(switchNode.discriminant(), Punctuators::isOpeningBrace);
        Token closingCurly = switchNode.close();
        List<SwitchCaseNode> cases = switchNode.cases();

        offsets.declareOffsets(openingCurly.end(), closingCurly.start(), openingCurly, context.options().switchCase());

        for (int index = 0; index < cases.size(); index++) {
            SwitchCaseNode switchCase = cases.get(index);
            Token caseKeyword = switchCase.keyword();
            boolean singleBlock = switchCase.consequent().size() == 1 && switchCase.consequent().get(0) instanceof BlockNode;
            if (!singleBlock) {
                Token tokenAfterCase = index == cases.size() - 1 ? closingCurly : cases.get(index + 1).keyword();
                offsets.declareOffsets(caseKeyword.end(), tokenAfterCase.start(), caseKeyword, 1);
            }
        }

        if (!cases.isEmpty()) {
            for (Token comment : tokens.commentsBetween(cases.get(cases.size() - 1).lastToken(), closingCurly)) {
                offsets.ignore(comment);
            }
        }
    }
}
