package org.dxworks.mdtree.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loosely-typed parse tree node as produced by a Markdown parser front end.
 * <p>
 * The kind is a free-form name (see {@link MarkupKinds}), attributes are untyped, and each child
 * is either a bare {@link String} token or another {@code MarkupElement}. Nothing here checks
 * that the shape makes sense; that is the converter's job.
 */
public final class MarkupElement {

    private final String kind;
    private final Map<String, Object> attributes;
    private final List<Object> children;

    private MarkupElement(String kind, Map<String, Object> attributes, List<Object> children) {
        this.kind = kind;
        this.attributes = attributes;
        this.children = children;
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    public String getKind() {
        return kind;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    public List<Object> getChildren() {
        return children;
    }

    public boolean is(String otherKind) {
        return kind.equals(otherKind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MarkupElement other)) {
            return false;
        }
        return kind.equals(other.kind) && attributes.equals(other.attributes) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, attributes, children);
    }

    @Override
    public String toString() {
        return kind + (attributes.isEmpty() ? "" : attributes.toString()) + children;
    }

    public static final class Builder {
        private final String kind;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<Object> children = new ArrayList<>();

        private Builder(String kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder attribute(String name, Object value) {
            attributes.put(name, value);
            return this;
        }

        public Builder child(Object child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(List<?> newChildren) {
            for (Object child : newChildren) {
                child(child);
            }
            return this;
        }

        public MarkupElement build() {
            return new MarkupElement(kind,
                    Collections.unmodifiableMap(new LinkedHashMap<>(attributes)),
                    Collections.unmodifiableList(new ArrayList<>(children)));
        }
    }
}
