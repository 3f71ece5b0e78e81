package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.List;

/**
 * The root of the tree: all top-level statements of a file.
 *
 * @param body The top-level statements.
 * @param first The first code token of the file, or null for an empty file.
 * @param last The last code token of the file, or null for an empty file.
 */
public record ProgramNode(
        List<AstNode> body,
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
    public int start() {
        return first == null ? 0 : first.start();
    }

    @Override
    public int end() {
        return last == null ? 0 : last.end();
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
