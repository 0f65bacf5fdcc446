package org.dxworks.mdtree.convert;

import org.dxworks.mdtree.model.MarkdownTreeException;
import org.dxworks.mdtree.model.NodeClass;

import java.util.Locale;

/**
 * The parse tree contains a node kind with no mapping in the given context.
 */
public class UnsupportedNodeKindException extends MarkdownTreeException {

    private final String kind;
    private final NodeClass context;

    public UnsupportedNodeKindException(String kind, NodeClass context) {
        super("unsupported " + describe(context) + " node kind '" + kind + "'");
        this.kind = kind;
        this.context = context;
    }

    public String getKind() {
        return kind;
    }

    /**
     * @return the context the node appeared in, or {@code null} for the document root
     */
    public NodeClass getContext() {
        return context;
    }

    private static String describe(NodeClass context) {
        return context == null ? "root" : context.name().toLowerCase(Locale.ROOT);
    }
}
