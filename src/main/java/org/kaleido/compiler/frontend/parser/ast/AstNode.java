package org.kaleido.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Every node exclusively owns its children; nodes are immutable once built.
 */
public interface AstNode {
    /**
     * Returns a list of the direct child nodes, in source order.
     * This allows generic traversals without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
