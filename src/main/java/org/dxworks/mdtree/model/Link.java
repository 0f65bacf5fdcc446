package org.dxworks.mdtree.model;

import java.util.List;
import java.util.Objects;

/**
 * Hyperlink. Link titles are not represented.
 */
public record Link(String destination, List<Inline> nodes) implements Inline {

    public Link {
        Objects.requireNonNull(destination, "destination");
        nodes = List.copyOf(nodes);
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
