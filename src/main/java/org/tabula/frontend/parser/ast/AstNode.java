package org.tabula.frontend.parser.ast;

import org.tabula.frontend.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * A node spans the tokens from {@link #firstToken()} to {@link #lastToken()}, both
 * inclusive. Grouping parentheses around a whole node are not part of it, but a node
 * whose leftmost operand is parenthesized starts at that parenthesis.
 */
public interface AstNode {

    /**
     * @return The first token of this node.
     */
    Token firstToken();

    /**
     * @return The last token of this node.
     */
    Token lastToken();

    /**
     * @return The offset at which this node starts.
     */
    default int start() {
        return firstToken().start();
    }

    /**
     * @return The offset just past the end of this node.
     */
    default int end() {
        return lastToken().end();
    }

    /**
     * Returns a list of the direct child nodes, in source order.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
