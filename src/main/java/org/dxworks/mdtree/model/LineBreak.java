package org.dxworks.mdtree.model;

/**
 * Hard line break.
 */
public record LineBreak() implements Inline {

    @Override
    public <R> R accept(InlineVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
