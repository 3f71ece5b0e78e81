package org.tabula.rules.features;

import org.tabula.frontend.parser.ast.ArrayNode;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.ObjectNode;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;

/**
 * Indents the elements of array literals and the properties of object literals.
 */
public class ArrayObjectIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        if (node instanceof ArrayNode array) {
            context.elementListIndent(array.elements(), array.open(), array.close(),
                    context.options().arrayExpression());
        } else if (node instanceof ObjectNode object) {
            context.elementListIndent(object.properties(), object.open(), object.close(),
                    context.options().objectExpression());
        }
    }
}
