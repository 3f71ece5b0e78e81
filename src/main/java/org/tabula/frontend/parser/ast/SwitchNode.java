package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A <code>switch</code> statement.
 *
 * @param keyword The <code>switch</code> keyword.
 * @param discriminant The switched-on expression.
 * @param cases The cases in source order.
 * @param close The closing brace.
 */
public record SwitchNode(
        Token keyword,
        AstNode discriminant,
        List<SwitchCaseNode> cases,
        Token close
) implements StatementNode {

    @Override
    public Token firstToken() {
        return keyword;
    }

    @Override
    public Token lastToken() {
        return close;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(discriminant, cases);
    }
}
