package org.dxworks.mdtree.model;

import java.util.List;
import java.util.Objects;

/**
 * Admonition box such as {@code !!! warning "Title"}.
 */
public record Admonition(String category, String title, List<Block> nodes) implements Block {

    public Admonition {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(title, "title");
        nodes = List.copyOf(nodes);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
