package org.dxworks.mdtree.model;

import java.util.List;

public record Paragraph(List<Inline> nodes) implements Block {

    public Paragraph {
        nodes = List.copyOf(nodes);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
