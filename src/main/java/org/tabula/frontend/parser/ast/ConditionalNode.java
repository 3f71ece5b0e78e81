package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * A ternary conditional, <code>test ? consequent : alternate</code>.
 *
 * @param test The condition.
 * @param question The <code>?</code> token.
 * @param consequent The value when the condition holds.
 * @param colon The <code>:</code> token.
 * @param alternate The value otherwise.
 * @param first The first token of the expression.
 * @param last The last token of the expression.
 */
public record ConditionalNode(
        AstNode test,
        Token question,
        AstNode consequent,
        Token colon,
        AstNode alternate,
        Token first,
        Token last
) implements AstNode {

    @Override
    public Token firstToken() {
        return first;
    }

    @Override
    public Token lastToken() {
        return last;
    }

    @Override
    public List<AstNode> getChildren() {
        return Children.of(test, consequent, alternate);
    }
}
