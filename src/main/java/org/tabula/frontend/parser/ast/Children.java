package org.tabula.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds child lists for {@link AstNode#getChildren()}, skipping absent parts.
 */
final class Children {

    private Children() {}

    static List<AstNode> of(Object... parts) {
        List<AstNode> children = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode node) {
                children.add(node);
            } else if (part instanceof Collection<?> nodes) {
                for (Object node : nodes) {
                    if (node instanceof AstNode child) {
                        children.add(child);
                    }
                }
            }
        }
        return children;
    }
}
