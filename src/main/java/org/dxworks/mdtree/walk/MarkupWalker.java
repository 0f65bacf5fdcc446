package org.dxworks.mdtree.walk;

import org.dxworks.mdtree.markup.MarkupElement;

/**
 * Contextual walk directly over a generic parse tree, before conversion.
 * Nodes are {@link MarkupElement}s or bare {@link String} tokens; strings have no children.
 */
public final class MarkupWalker {

    private MarkupWalker() {
    }

    /**
     * Visits {@code root} (with a {@code null} parent) and then every descendant in pre-order.
     */
    public static void walk(ContextualVisitor<Object> visitor, MarkupElement root) {
        walk(visitor, new WalkContext(), null, root);
    }

    private static void walk(ContextualVisitor<Object> visitor, WalkContext context, Object parent, Object node) {
        WalkContext scope = context.copy();
        visitor.visit(scope, parent, node);
        if (node instanceof MarkupElement element) {
            for (Object child : element.getChildren()) {
                walk(visitor, scope, element, child);
            }
        }
    }
}
