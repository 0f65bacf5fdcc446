package org.dxworks.mdtree.model;

import java.util.Objects;

/**
 * Fenced or indented code. {@code language} is empty when the block has no info string;
 * {@code code} is kept exactly as parsed.
 */
public record CodeBlock(String language, String code) implements Block {

    public CodeBlock {
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(code, "code");
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
