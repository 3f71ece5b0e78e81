package org.tabula.rules.features;

import org.tabula.frontend.lexer.Token;
import org.tabula.frontend.parser.ast.AstNode;
import org.tabula.frontend.parser.ast.VariableDeclarationNode;
import org.tabula.frontend.parser.ast.VariableDeclaratorNode;
import org.tabula.indent.OffsetStorage;
import org.tabula.rules.IIndentRule;
import org.tabula.rules.IndentContext;
import org.tabula.rules.Punctuators;

/**
 * Indents continued variable declarations by the level configured for their keyword.
 * <p>
 * When several declarators span lines, the offset is forced: tokens on the keyword's own
 * line are indented too, so that
 * <pre>
 * var foo = {
 *     ok: true
 *   },
 *   bar = 1;
 * </pre>
 * is accepted.
 */
public class VariableDeclarationIndentRule implements IIndentRule {

    @Override
    public void apply(AstNode node, IndentContext context) {
        VariableDeclarationNode declaration = (VariableDeclarationNode) node;
        OffsetStorage offsets = context.offsets();
        int level = context.options().variableDeclaratorLevel(declaration.kind().text());

        VariableDeclaratorNode lastDeclarator = declaration.declarations().get(declaration.declarations().size() - 1);
        boolean forced = lastDeclarator.firstToken().line() > declaration.firstToken().line();
        offsets.declareOffsets(declaration.start(), declaration.end(), declaration.firstToken(), level, forced);

        Token lastToken = declaration.lastToken();
        if (Punctuators.isSemicolon(lastToken)) {
            offsets.ignore(lastToken);
        }
    }
}
