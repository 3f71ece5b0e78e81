package org.tabula.frontend.parser.ast;

/**
 * Marker for nodes that stand as statements or declarations in a statement list.
 */
public interface StatementNode extends AstNode {
}
