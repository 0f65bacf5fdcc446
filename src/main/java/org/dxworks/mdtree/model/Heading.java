package org.dxworks.mdtree.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * ATX or setext heading. The level is checked when the heading is built, never clamped.
 */
public final class Heading implements Block {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 6;

    private final int level;
    private final List<Inline> nodes;

    private Heading(int level, List<Inline> nodes) {
        this.level = level;
        this.nodes = nodes;
    }

    public static Heading of(int level, List<? extends Inline> nodes) throws RangeViolationException {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new RangeViolationException("heading level", level, MIN_LEVEL, MAX_LEVEL);
        }
        return new Heading(level, List.copyOf(nodes));
    }

    @JsonProperty
    public int level() {
        return level;
    }

    @JsonProperty
    public List<Inline> nodes() {
        return nodes;
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Heading other)) {
            return false;
        }
        return level == other.level && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, nodes);
    }

    @Override
    public String toString() {
        return "Heading[level=" + level + ", nodes=" + nodes + "]";
    }
}
