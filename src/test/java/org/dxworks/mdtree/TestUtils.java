package org.dxworks.mdtree;

import org.dxworks.mdtree.markup.MarkupElement;
import org.dxworks.mdtree.markup.MarkupKinds;

import java.util.List;

public class TestUtils {

    public static MarkupElement el(String kind, Object... children) {
        return MarkupElement.builder(kind).children(List.of(children)).build();
    }

    public static MarkupElement document(Object... blocks) {
        return el(MarkupKinds.DOCUMENT, blocks);
    }

    public static MarkupElement header(int level, Object... children) {
        return MarkupElement.builder(MarkupKinds.HEADER)
                .attribute(MarkupKinds.LEVEL, level)
                .children(List.of(children))
                .build();
    }

    public static MarkupElement paragraph(Object... children) {
        return el(MarkupKinds.PARAGRAPH, children);
    }

    public static MarkupElement bold(Object... children) {
        return el(MarkupKinds.BOLD, children);
    }

    public static MarkupElement italic(Object... children) {
        return el(MarkupKinds.ITALIC, children);
    }

    public static MarkupElement code(String language, String code) {
        return MarkupElement.builder(MarkupKinds.CODE)
                .attribute(MarkupKinds.LANGUAGE, language)
                .attribute(MarkupKinds.CODE_TEXT, code)
                .build();
    }

    public static MarkupElement inlineCode(String language, String code) {
        return MarkupElement.builder(MarkupKinds.INLINE_CODE)
                .attribute(MarkupKinds.LANGUAGE, language)
                .attribute(MarkupKinds.CODE_TEXT, code)
                .build();
    }

    public static MarkupElement withFormula(String kind, String formula) {
        return MarkupElement.builder(kind).attribute(MarkupKinds.FORMULA, formula).build();
    }

    public static MarkupElement withId(String kind, String id, Object... children) {
        return MarkupElement.builder(kind)
                .attribute(MarkupKinds.ID, id)
                .children(List.of(children))
                .build();
    }

    /**
     * The example document: a heading, a paragraph with strong text and a horizontal rule.
     */
    public static MarkupElement exampleTree() {
        return document(
                header(1, "Header"),
                paragraph("Hello ", bold("World")),
                el(MarkupKinds.HORIZONTAL_RULE));
    }
}
