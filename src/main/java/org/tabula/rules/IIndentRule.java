package org.tabula.rules;

import org.tabula.frontend.parser.ast.AstNode;

/**
 * Interface for the per-construct indentation rules.
 * Each rule declares the offsets of the tokens of one kind of AST node.
 */
@FunctionalInterface
public interface IIndentRule {
    /**
     * Declares the indentation offsets for a node.
     * @param node The node being entered.
     * @param context The shared state of the current file.
     */
    void apply(AstNode node, IndentContext context);
}
