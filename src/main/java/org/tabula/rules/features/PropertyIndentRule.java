package org.tabula.rules.features;

import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.PropertyNode;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * The value of an object property may start on its own line at any indentation.
 */
public class PropertyIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        PropertyNode property = (PropertyNode) node;
        context.offsets().ignore(context.tokens().tokenAfter(property.colon()));
    }
}
