package org.dxworks.mdtree.model;

import java.util.List;

public record Strong(List<Inline> nodes) implements Inline {

    public Strong {
        nodes = List.copyOf(nodes);
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
