package org.dxworks.mdtree.model;

public record ThematicBreak() implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
