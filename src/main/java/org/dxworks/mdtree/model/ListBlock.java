package org.dxworks.mdtree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bullet or ordered list. Each item is its own sequence of blocks.
 *
 * @param ordered whether the list is numbered
 * @param start   number of the first item, only meaningful for ordered lists
 * @param tight   whether items are separated without blank lines
 * @param items   the list items in source order
 */
public record ListBlock(boolean ordered, int start, boolean tight, List<List<Block>> items) implements Block {

    public ListBlock {
        List<List<Block>> copied = new ArrayList<>(items.size());
        for (List<Block> item : items) {
            copied.add(List.copyOf(item));
        }
        items = Collections.unmodifiableList(copied);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
