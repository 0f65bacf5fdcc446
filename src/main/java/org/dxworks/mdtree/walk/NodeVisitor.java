package org.dxworks.mdtree.walk;

import org.dxworks.mdtree.model.Node;
import org.dxworks.mdtree.model.NodeClass;

/**
 * Called once per node by {@link MarkdownWalker#walk(NodeVisitor, org.dxworks.mdtree.model.Document)}.
 */
@FunctionalInterface
public interface NodeVisitor {

    /**
     * @return {@code true} to descend into the node's children, {@code false} to skip them;
     *         siblings are visited either way
     */
    boolean visit(NodeClass nodeClass, Node node);
}
