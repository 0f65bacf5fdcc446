package org.dxworks.mdtree.model;

import java.util.List;

public record BlockQuote(List<Block> nodes) implements Block {

    public BlockQuote {
        nodes = List.copyOf(nodes);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
