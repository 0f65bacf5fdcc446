package org.dxworks.mdtree.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a {@link Footnote} by id. Carries no content of its own.
 */
public final class FootnoteReference implements Inline {

    private final String id;

    private FootnoteReference(String id) {
        this.id = id;
    }

    public static FootnoteReference of(String id) {
        return new FootnoteReference(Objects.requireNonNull(id, "id"));
    }

    public static FootnoteReference of(String id, List<?> body) throws InvariantViolationException {
        if (body != null && !body.isEmpty()) {
            throw new InvariantViolationException("footnote reference [^" + id + "] must not have a body, got "
                    + body.size() + " element(s)");
        }
        return of(id);
    }

    @JsonProperty
    public String id() {
        return id;
    }

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FootnoteReference other && id.equals(other.id));
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "FootnoteReference[id=" + id + "]";
    }
}
