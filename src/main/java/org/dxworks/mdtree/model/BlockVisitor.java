package org.dxworks.mdtree.model;

/**
 * One method per block variant. Adding a variant to {@link Block} breaks every implementation.
 */
public interface BlockVisitor<R> {

    R visit(ThematicBreak thematicBreak);

    R visit(Heading heading);

    R visit(CodeBlock codeBlock);

    R visit(Paragraph paragraph);

    R visit(BlockQuote blockQuote);

    R visit(ListBlock list);

    R visit(DisplayMath displayMath);

    R visit(Footnote footnote);

    R visit(Table table);

    R visit(Admonition admonition);
}
