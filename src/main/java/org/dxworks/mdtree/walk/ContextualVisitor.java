package org.dxworks.mdtree.walk;

/**
 * Visitor that sees the parent of each node and a scope shared with the node's descendants.
 * Walks using it never prune.
 *
 * @param <N> the node type of the walked tree
 */
@FunctionalInterface
public interface ContextualVisitor<N> {

    /**
     * @param context scope for this node; values put here are visible to its descendants only
     * @param parent  the enclosing node, {@code null} at the top level
     * @param node    the node being visited
     */
    void visit(WalkContext context, N parent, N node);
}
