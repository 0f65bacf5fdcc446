package org.dxworks.mdtree.model;

/**
 * One method per inline variant. Adding a variant to {@link Inline} breaks every implementation.
 */
public interface InlineVisitor<R> {

    R visit(Text text);

    R visit(CodeSpan codeSpan);

    R visit(Emphasis emphasis);

    R visit(Strong strong);

    R visit(Link link);

    R visit(Image image);

    R visit(LineBreak lineBreak);

    R visit(InlineMath inlineMath);

    R visit(FootnoteReference footnoteReference);
}
