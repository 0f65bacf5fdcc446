package org.dxworks.mdtree.model;

import java.util.List;
import java.util.Objects;

/**
 * Image with its alt text kept as inline content.
 *
 * @param title empty when the source has no title
 */
public record Image(String destination, String title, List<Inline> alt) implements Inline {

    public Image {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(title, "title");
        alt = List.copyOf(alt);
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
