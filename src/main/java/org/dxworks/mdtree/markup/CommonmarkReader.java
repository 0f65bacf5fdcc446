package org.dxworks.mdtree.markup;

import org.commonmark.ext.footnotes.FootnoteDefinition;
import org.commonmark.ext.footnotes.FootnoteReference;
import org.commonmark.ext.footnotes.FootnotesExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Front end turning Markdown text into a generic {@link MarkupElement} tree with commonmark-java.
 * <p>
 * The reader itself never fails on node types it does not know: they come out as elements named
 * after the commonmark class, and the converter decides what to do with them.
 */
public class CommonmarkReader {

    public static final String DEFAULT_MATH_FENCE_INFO = "math";
    static final String SOFT_BREAK = "\n";

    private final Parser parser;
    private final String mathFenceInfo;

    public CommonmarkReader() {
        this(DEFAULT_MATH_FENCE_INFO);
    }

    public CommonmarkReader(String mathFenceInfo) {
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        FootnotesExtension.create(),
                        YamlFrontMatterExtension.create()
                ))
                .build();
        this.mathFenceInfo = mathFenceInfo;
    }

    public MarkupElement read(String markdown) {
        Node document = parser.parse(markdown);
        return toElement(document);
    }

    private MarkupElement toElement(Node node) {
        if (node instanceof Document) {
            return element(MarkupKinds.DOCUMENT, node).build();
        }
        if (node instanceof Heading heading) {
            return element(MarkupKinds.HEADER, node)
                    .attribute(MarkupKinds.LEVEL, heading.getLevel())
                    .build();
        }
        if (node instanceof ThematicBreak) {
            return MarkupElement.builder(MarkupKinds.HORIZONTAL_RULE).build();
        }
        if (node instanceof FencedCodeBlock codeBlock) {
            String info = codeBlock.getInfo() == null ? "" : codeBlock.getInfo().trim();
            String literal = stripTrailingNewline(codeBlock.getLiteral());
            if (mathFenceInfo != null && !mathFenceInfo.isEmpty() && info.equals(mathFenceInfo)) {
                return MarkupElement.builder(MarkupKinds.DISPLAY_MATH)
                        .attribute(MarkupKinds.FORMULA, literal)
                        .build();
            }
            return MarkupElement.builder(MarkupKinds.CODE)
                    .attribute(MarkupKinds.LANGUAGE, info)
                    .attribute(MarkupKinds.CODE_TEXT, literal)
                    .build();
        }
        if (node instanceof IndentedCodeBlock codeBlock) {
            return MarkupElement.builder(MarkupKinds.CODE)
                    .attribute(MarkupKinds.LANGUAGE, "")
                    .attribute(MarkupKinds.CODE_TEXT, stripTrailingNewline(codeBlock.getLiteral()))
                    .build();
        }
        if (node instanceof Paragraph) {
            return element(MarkupKinds.PARAGRAPH, node).build();
        }
        if (node instanceof BlockQuote) {
            return element(MarkupKinds.BLOCK_QUOTE, node).build();
        }
        if (node instanceof ListBlock list) {
            return createListElement(list);
        }
        if (node instanceof ListItem) {
            return element(MarkupKinds.LIST_ITEM, node).build();
        }
        if (node instanceof TableBlock table) {
            return createTableElement(table);
        }
        if (node instanceof FootnoteDefinition footnote) {
            return element(MarkupKinds.FOOTNOTE_DEFINITION, node)
                    .attribute(MarkupKinds.ID, footnote.getLabel())
                    .build();
        }
        if (node instanceof HtmlBlock) {
            return MarkupElement.builder(MarkupKinds.HTML_BLOCK).build();
        }
        if (node instanceof Code code) {
            return MarkupElement.builder(MarkupKinds.INLINE_CODE)
                    .attribute(MarkupKinds.LANGUAGE, "")
                    .attribute(MarkupKinds.CODE_TEXT, code.getLiteral())
                    .build();
        }
        if (node instanceof Emphasis) {
            return element(MarkupKinds.ITALIC, node).build();
        }
        if (node instanceof StrongEmphasis) {
            return element(MarkupKinds.BOLD, node).build();
        }
        if (node instanceof Link link) {
            return element(MarkupKinds.LINK, node)
                    .attribute(MarkupKinds.URL, link.getDestination())
                    .attribute(MarkupKinds.TITLE, link.getTitle())
                    .build();
        }
        if (node instanceof Image image) {
            return element(MarkupKinds.IMAGE, node)
                    .attribute(MarkupKinds.URL, image.getDestination())
                    .attribute(MarkupKinds.TITLE, image.getTitle())
                    .build();
        }
        if (node instanceof HardLineBreak) {
            return MarkupElement.builder(MarkupKinds.LINE_BREAK).build();
        }
        if (node instanceof FootnoteReference reference) {
            return MarkupElement.builder(MarkupKinds.FOOTNOTE_REFERENCE)
                    .attribute(MarkupKinds.ID, reference.getLabel())
                    .build();
        }
        if (node instanceof HtmlInline) {
            return MarkupElement.builder(MarkupKinds.INLINE_HTML).build();
        }
        return element(node.getClass().getSimpleName(), node).build();
    }

    private MarkupElement.Builder element(String kind, Node node) {
        return MarkupElement.builder(kind).children(childrenOf(node));
    }

    private List<Object> childrenOf(Node node) {
        List<Object> children = new ArrayList<>();
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof YamlFrontMatterBlock || child instanceof LinkReferenceDefinition) {
                // already consumed by the parser
                continue;
            }
            if (child instanceof Text text) {
                children.add(text.getLiteral());
            } else if (child instanceof SoftLineBreak) {
                children.add(SOFT_BREAK);
            } else {
                children.add(toElement(child));
            }
        }
        return children;
    }

    private MarkupElement createListElement(ListBlock list) {
        MarkupElement.Builder builder = element(MarkupKinds.LIST, list)
                .attribute(MarkupKinds.ORDERED, list instanceof OrderedList)
                .attribute(MarkupKinds.TIGHT, list.isTight());
        if (list instanceof OrderedList ordered && ordered.getMarkerStartNumber() != null) {
            builder.attribute(MarkupKinds.START, ordered.getMarkerStartNumber());
        }
        return builder.build();
    }

    private MarkupElement createTableElement(TableBlock table) {
        List<String> alignments = new ArrayList<>();
        List<Object> rows = new ArrayList<>();
        // TableHead and TableBody only group rows
        for (Node section = table.getFirstChild(); section != null; section = section.getNext()) {
            for (Node row = section.getFirstChild(); row != null; row = row.getNext()) {
                if (!(row instanceof TableRow)) {
                    continue;
                }
                MarkupElement.Builder rowBuilder = MarkupElement.builder(MarkupKinds.TABLE_ROW);
                for (Node cell = row.getFirstChild(); cell != null; cell = cell.getNext()) {
                    if (rows.isEmpty() && cell instanceof TableCell tableCell) {
                        alignments.add(alignmentName(tableCell.getAlignment()));
                    }
                    rowBuilder.child(MarkupElement.builder(MarkupKinds.TABLE_CELL)
                            .children(childrenOf(cell))
                            .build());
                }
                rows.add(rowBuilder.build());
            }
        }
        return MarkupElement.builder(MarkupKinds.TABLE)
                .attribute(MarkupKinds.ALIGNMENTS, alignments)
                .children(rows)
                .build();
    }

    private static String alignmentName(TableCell.Alignment alignment) {
        if (alignment == null) {
            return "none";
        }
        return switch (alignment) {
            case LEFT -> "left";
            case CENTER -> "center";
            case RIGHT -> "right";
        };
    }

    private static String stripTrailingNewline(String literal) {
        if (literal == null) {
            return "";
        }
        return literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
    }
}
