package org.dxworks.mdtree.model;

import java.util.Objects;

public record InlineMath(String formula) implements Inline {

    public InlineMath {
        Objects.requireNonNull(formula, "formula");
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
