package org.tabula.frontend;

import org.tabula.frontend.parser.ast.AstNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between the checking phases and the AST structure.
 * <p>
 * Nodes are visited parent before children, children in source order. Exit handlers
 * run after all children of a node have been visited. The walker records the parent
 * of every node it visits, so handlers can look upwards.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> enterHandlers;
    private final Map<Class<? extends AstNode>, Consumer<AstNode>> exitHandlers;
    private final Map<AstNode, AstNode> parents = new IdentityHashMap<>();

    /**
     * Constructs a new TreeWalker with enter handlers only.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this(handlers, Collections.emptyMap());
    }

    /**
     * Constructs a new TreeWalker.
     * @param enterHandlers Handlers run when a node is entered, before its children.
     * @param exitHandlers Handlers run when a node is left, after its children.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> enterHandlers,
                      Map<Class<? extends AstNode>, Consumer<AstNode>> exitHandlers) {
        this.enterHandlers = enterHandlers;
        this.exitHandlers = exitHandlers;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            visit(node, null);
        }
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        visit(node, null);
    }

    /**
     * Returns the parent of a node visited by this walker.
     * @param node A node that has already been entered.
     * @return The parent node, or null for a root.
     */
    public AstNode parentOf(AstNode node) {
        return parents.get(node);
    }

    private void visit(AstNode node, AstNode parent) {
        if (node == null) {
            return;
        }
        parents.put(node, parent);

        handlers(enterHandlers, node).accept(node);

        // Descend recursively into ALL children without knowing their type.
        for (AstNode child : node.getChildren()) {
            visit(child, node);
        }

        handlers(exitHandlers, node).accept(node);
    }

    private static Consumer<AstNode> handlers(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers, AstNode node) {
        return handlers.getOrDefault(node.getClass(), n -> {});
    }
}
