package org.dxworks.mdtree.markup;

/**
 * Kind names of {@link MarkupElement}s understood by the converter, and the attribute keys they use.
 */
public final class MarkupKinds {

    private MarkupKinds() {
    }

    // block kinds
    public static final String DOCUMENT = "document";
    public static final String HORIZONTAL_RULE = "horizontal-rule";
    public static final String HEADER = "header";
    public static final String CODE = "code";
    public static final String PARAGRAPH = "paragraph";
    public static final String BLOCK_QUOTE = "block-quote";
    public static final String DISPLAY_MATH = "display-math";
    public static final String FOOTNOTE_DEFINITION = "footnote-definition";
    public static final String LIST = "list";
    public static final String LIST_ITEM = "list-item";
    public static final String TABLE = "table";
    public static final String TABLE_ROW = "table-row";
    public static final String TABLE_CELL = "table-cell";
    public static final String ADMONITION = "admonition";
    public static final String HTML_BLOCK = "html-block";

    // inline kinds
    public static final String INLINE_CODE = "inline-code";
    public static final String BOLD = "bold";
    public static final String ITALIC = "italic";
    public static final String LINK = "link";
    public static final String IMAGE = "image";
    public static final String LINE_BREAK = "line-break";
    public static final String INLINE_MATH = "inline-math";
    public static final String FOOTNOTE_REFERENCE = "footnote-reference";
    public static final String INLINE_HTML = "inline-html";

    // attributes
    public static final String LEVEL = "level";
    public static final String LANGUAGE = "language";
    public static final String CODE_TEXT = "code";
    public static final String FORMULA = "formula";
    public static final String ID = "id";
    public static final String URL = "url";
    public static final String TITLE = "title";
    public static final String ORDERED = "ordered";
    public static final String START = "start";
    public static final String TIGHT = "tight";
    public static final String ALIGNMENTS = "alignments";
    public static final String CATEGORY = "category";
}
