package org.dxworks.mdtree.model;

/**
 * A structural unit standing alone at document or container level.
 */
public sealed interface Block extends Node
        permits ThematicBreak, Heading, CodeBlock, Paragraph, BlockQuote, ListBlock,
                DisplayMath, Footnote, Table, Admonition {

    <R> R accept(BlockVisitor<R> visitor);

    @Override
    default NodeClass nodeClass() {
        return NodeClass.BLOCK;
    }
}
