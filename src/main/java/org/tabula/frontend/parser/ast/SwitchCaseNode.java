package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * One <code>case</code> or <code>default</code> clause of a switch.
 *
 * @param keyword The <code>case</code> or <code>default</code> keyword.
 * @param test The case value, or null for <code>default</code>.
 * @param consequent The statements of the clause.
 * @param last The last token of the clause.
 */
public record SwitchCaseNode(
        Token keyword,
        AstNode test,
        List<AstNode> consequent,
        Token last
) implements AstNode {

    @Override
    public Token firstToken() {
        return keyword;
    }

    @Override
    public Token lastToken() {
        return last;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, consequent);
    }
}
