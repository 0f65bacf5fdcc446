package org.dxworks.mdtree.model;

import java.util.List;
import java.util.Objects;

/**
 * Footnote definition. Matched against {@link FootnoteReference#id()} by consumers, not here.
 */
public record Footnote(String id, List<Block> nodes) implements Block {

    public Footnote {
        Objects.requireNonNull(id, "id");
        nodes = List.copyOf(nodes);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
