package org.dxworks.mdtree.model;

import java.util.List;

/**
 * Content of one table cell. Not a node itself; the walker descends straight into its inlines.
 */
public record TableCell(List<Inline> nodes) {

    public TableCell {
        nodes = List.copyOf(nodes);
    }
}
