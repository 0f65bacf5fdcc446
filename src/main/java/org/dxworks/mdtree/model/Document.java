package org.dxworks.mdtree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Root of a converted Markdown file: the top-level blocks in source order.
 * Only explicit appends and index-sets change it; nothing reorders the blocks.
 */
public final class Document {

    private final List<Block> nodes;

    public Document() {
        this.nodes = new ArrayList<>();
    }

    public Document(List<? extends Block> nodes) {
        this.nodes = new ArrayList<>(nodes.size());
        for (Block node : nodes) {
            add(node);
        }
    }

    public List<Block> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public void add(Block node) {
        nodes.add(Objects.requireNonNull(node, "node"));
    }

    public void add(int index, Block node) {
        nodes.add(index, Objects.requireNonNull(node, "node"));
    }

    public Block set(int index, Block node) {
        return nodes.set(index, Objects.requireNonNull(node, "node"));
    }

    public Block get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Document other && nodes.equals(other.nodes));
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "Document" + nodes;
    }
}
