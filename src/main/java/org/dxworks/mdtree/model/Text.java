package org.dxworks.mdtree.model;

import java.util.Objects;

/**
 * Literal text, never tokenized further.
 */
public record Text(String text) implements Inline {

    public Text {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
