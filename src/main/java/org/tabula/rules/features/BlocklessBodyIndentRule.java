package org.tabula.rules.features;

import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.DoWhileNode;
import org.tabula.frontend.parser.ast.IfNode;
import org.tabula.frontend.parser.ast.WhileNode;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * Indents the bodies of <code>if</code>, <code>else</code>, <code>while</code> and
 * <code>do</code> when they are written without braces. An <code>else if</code> chain
 * stays at the level of the first <code>if</code>.
 */
public class BlocklessBodyIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        if (node instanceof IfNode ifNode) {
            context.blocklessBodyIndent(ifNode.consequent());
            if (ifNode.alternate() != null && !(ifNode.alternate() instanceof IfNode)) {
                context.blocklessBodyIndent(ifNode.alternate());
            }
        } else if (node instanceof WhileNode whileNode) {
            context.blocklessBodyIndent(whileNode.body());
        } else if (node instanceof DoWhileNode doWhile) {
            context.blocklessBodyIndent(doWhile.body());
        }
    }
}
