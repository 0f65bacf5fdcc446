package org.dxworks.mdtree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pipe table. {@code rows.get(0)} is the header row when the table has any rows.
 */
public record Table(List<Alignment> alignments, List<List<TableCell>> rows) implements Block {

    public enum Alignment {
        LEFT,
        CENTER,
        RIGHT,
        NONE
    }

    public Table {
        alignments = List.copyOf(alignments);
        List<List<TableCell>> copied = new ArrayList<>(rows.size());
        for (List<TableCell> row : rows) {
            copied.add(List.copyOf(row));
        }
        rows = Collections.unmodifiableList(copied);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
