package org.dxworks.mdtree.model;

/**
 * A unit of the text flow inside a block.
 */
public sealed interface Inline extends Node
        permits Text, CodeSpan, Emphasis, Strong, Link, Image, LineBreak, InlineMath, FootnoteReference {

    <R> R accept(InlineVisitor<R> visitor);

    @Override
    default NodeClass nodeClass() {
        return NodeClass.INLINE;
    }
}
