package org.dxworks.mdtree.model;

import java.util.Objects;

public record DisplayMath(String formula) implements Block {

    public DisplayMath {
        Objects.requireNonNull(formula, "formula");
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
