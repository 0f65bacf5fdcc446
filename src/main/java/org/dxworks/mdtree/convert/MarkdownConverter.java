package org.dxworks.mdtree.convert;

import org.dxworks.mdtree.markup.MarkupElement;
import org.dxworks.mdtree.markup.MarkupKinds;
import org.dxworks.mdtree.model.Admonition;
import org.dxworks.mdtree.model.Block;
import org.dxworks.mdtree.model.BlockQuote;
import org.dxworks.mdtree.model.CodeBlock;
import org.dxworks.mdtree.model.CodeSpan;
import org.dxworks.mdtree.model.DisplayMath;
import org.dxworks.mdtree.model.Document;
import org.dxworks.mdtree.model.Emphasis;
import org.dxworks.mdtree.model.Footnote;
import org.dxworks.mdtree.model.FootnoteReference;
import org.dxworks.mdtree.model.Heading;
import org.dxworks.mdtree.model.Image;
import org.dxworks.mdtree.model.Inline;
import org.dxworks.mdtree.model.InlineMath;
import org.dxworks.mdtree.model.InvariantViolationException;
import org.dxworks.mdtree.model.LineBreak;
import org.dxworks.mdtree.model.Link;
import org.dxworks.mdtree.model.ListBlock;
import org.dxworks.mdtree.model.MarkdownTreeException;
import org.dxworks.mdtree.model.NodeClass;
import org.dxworks.mdtree.model.Paragraph;
import org.dxworks.mdtree.model.RangeViolationException;
import org.dxworks.mdtree.model.Strong;
import org.dxworks.mdtree.model.Table;
import org.dxworks.mdtree.model.TableCell;
import org.dxworks.mdtree.model.Text;
import org.dxworks.mdtree.model.ThematicBreak;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts a generic {@link MarkupElement} tree into the typed Markdown AST.
 * <p>
 * Conversion is depth-first and keeps sibling order. Nothing is normalized: strings are copied
 * as they are. Kinds without a mapping, and nodes violating a structural invariant, abort the
 * whole conversion; there is no partial result.
 */
public class MarkdownConverter {

    public Document convert(MarkupElement document) throws MarkdownTreeException {
        if (!document.is(MarkupKinds.DOCUMENT)) {
            throw new UnsupportedNodeKindException(document.getKind(), null);
        }
        return new Document(convertBlocks(document.getChildren()));
    }

    public List<Block> convertBlocks(List<?> children) throws MarkdownTreeException {
        List<Block> blocks = new ArrayList<>(children.size());
        for (Object child : children) {
            blocks.add(convertBlock(child));
        }
        return blocks;
    }

    public List<Inline> convertInlines(List<?> children) throws MarkdownTreeException {
        List<Inline> inlines = new ArrayList<>(children.size());
        for (Object child : children) {
            inlines.add(convertInline(child));
        }
        return inlines;
    }

    private Block convertBlock(Object child) throws MarkdownTreeException {
        if (!(child instanceof MarkupElement element)) {
            throw new UnsupportedNodeKindException(kindOf(child), NodeClass.BLOCK);
        }
        switch (element.getKind()) {
            case MarkupKinds.HORIZONTAL_RULE:
                return new ThematicBreak();
            case MarkupKinds.HEADER:
                return Heading.of(requireInt(element, MarkupKinds.LEVEL), convertInlines(element.getChildren()));
            case MarkupKinds.CODE:
                return new CodeBlock(optionalString(element, MarkupKinds.LANGUAGE, ""),
                        requireString(element, MarkupKinds.CODE_TEXT));
            case MarkupKinds.PARAGRAPH:
                return new Paragraph(convertInlines(element.getChildren()));
            case MarkupKinds.BLOCK_QUOTE:
                return new BlockQuote(convertBlocks(element.getChildren()));
            case MarkupKinds.DISPLAY_MATH:
                return new DisplayMath(requireString(element, MarkupKinds.FORMULA));
            case MarkupKinds.FOOTNOTE_DEFINITION:
                return new Footnote(requireString(element, MarkupKinds.ID), convertBlocks(element.getChildren()));
            case MarkupKinds.LIST:
                return convertList(element);
            case MarkupKinds.TABLE:
                return convertTable(element);
            case MarkupKinds.ADMONITION:
                return new Admonition(requireString(element, MarkupKinds.CATEGORY),
                        optionalString(element, MarkupKinds.TITLE, ""),
                        convertBlocks(element.getChildren()));
            default:
                throw new UnsupportedNodeKindException(element.getKind(), NodeClass.BLOCK);
        }
    }

    private Inline convertInline(Object child) throws MarkdownTreeException {
        if (child instanceof String text) {
            return new Text(text);
        }
        if (!(child instanceof MarkupElement element)) {
            throw new UnsupportedNodeKindException(kindOf(child), NodeClass.INLINE);
        }
        switch (element.getKind()) {
            case MarkupKinds.INLINE_CODE:
                return CodeSpan.of(optionalString(element, MarkupKinds.LANGUAGE, ""),
                        requireString(element, MarkupKinds.CODE_TEXT));
            case MarkupKinds.BOLD:
                return new Strong(convertInlines(element.getChildren()));
            case MarkupKinds.ITALIC:
                return new Emphasis(convertInlines(element.getChildren()));
            case MarkupKinds.LINK:
                // the title attribute has no place in the model and is dropped
                return new Link(requireString(element, MarkupKinds.URL), convertInlines(element.getChildren()));
            case MarkupKinds.IMAGE:
                return new Image(requireString(element, MarkupKinds.URL),
                        optionalString(element, MarkupKinds.TITLE, ""),
                        convertInlines(element.getChildren()));
            case MarkupKinds.LINE_BREAK:
                return new LineBreak();
            case MarkupKinds.INLINE_MATH:
                return new InlineMath(requireString(element, MarkupKinds.FORMULA));
            case MarkupKinds.FOOTNOTE_REFERENCE:
                return FootnoteReference.of(requireString(element, MarkupKinds.ID), element.getChildren());
            default:
                throw new UnsupportedNodeKindException(element.getKind(), NodeClass.INLINE);
        }
    }

    private ListBlock convertList(MarkupElement list) throws MarkdownTreeException {
        List<List<Block>> items = new ArrayList<>();
        for (Object child : list.getChildren()) {
            MarkupElement item = requireElement(child, MarkupKinds.LIST_ITEM, list);
            items.add(convertBlocks(item.getChildren()));
        }
        return new ListBlock(
                optionalBoolean(list, MarkupKinds.ORDERED, false),
                optionalInt(list, MarkupKinds.START, 1),
                optionalBoolean(list, MarkupKinds.TIGHT, true),
                items);
    }

    private Table convertTable(MarkupElement table) throws MarkdownTreeException {
        List<List<TableCell>> rows = new ArrayList<>();
        for (Object rowChild : table.getChildren()) {
            MarkupElement row = requireElement(rowChild, MarkupKinds.TABLE_ROW, table);
            List<TableCell> cells = new ArrayList<>();
            for (Object cellChild : row.getChildren()) {
                MarkupElement cell = requireElement(cellChild, MarkupKinds.TABLE_CELL, row);
                cells.add(new TableCell(convertInlines(cell.getChildren())));
            }
            rows.add(cells);
        }
        return new Table(convertAlignments(table, rows), rows);
    }

    private List<Table.Alignment> convertAlignments(MarkupElement table, List<List<TableCell>> rows)
            throws InvariantViolationException {
        List<Table.Alignment> alignments = new ArrayList<>();
        Object value = table.getAttribute(MarkupKinds.ALIGNMENTS);
        if (value == null) {
            int columns = rows.isEmpty() ? 0 : rows.get(0).size();
            for (int i = 0; i < columns; i++) {
                alignments.add(Table.Alignment.NONE);
            }
            return alignments;
        }
        if (!(value instanceof List<?> names)) {
            throw invalidAttribute(table, MarkupKinds.ALIGNMENTS, "a list", value);
        }
        for (Object name : names) {
            alignments.add(toAlignment(table, name));
        }
        return alignments;
    }

    private static Table.Alignment toAlignment(MarkupElement table, Object name) throws InvariantViolationException {
        if (name instanceof String text) {
            switch (text.toLowerCase(Locale.ROOT)) {
                case "left":
                    return Table.Alignment.LEFT;
                case "center":
                    return Table.Alignment.CENTER;
                case "right":
                    return Table.Alignment.RIGHT;
                case "none":
                case "":
                    return Table.Alignment.NONE;
                default:
                    break;
            }
        }
        throw invalidAttribute(table, MarkupKinds.ALIGNMENTS, "left, center, right or none entries", name);
    }

    private static MarkupElement requireElement(Object child, String kind, MarkupElement parent)
            throws MarkdownTreeException {
        if (child instanceof MarkupElement element && element.is(kind)) {
            return element;
        }
        throw new InvariantViolationException(
                "'" + parent.getKind() + "' may only contain '" + kind + "' children, got '" + kindOf(child) + "'");
    }

    private static String requireString(MarkupElement element, String name) throws InvariantViolationException {
        Object value = element.getAttribute(name);
        if (value instanceof String text) {
            return text;
        }
        throw invalidAttribute(element, name, "a string", value);
    }

    private static String optionalString(MarkupElement element, String name, String defaultValue)
            throws InvariantViolationException {
        Object value = element.getAttribute(name);
        if (value == null) {
            return defaultValue;
        }
        return requireString(element, name);
    }

    private static int requireInt(MarkupElement element, String name) throws MarkdownTreeException {
        Object value = element.getAttribute(name);
        if (value instanceof Long wide) {
            if (wide < Integer.MIN_VALUE || wide > Integer.MAX_VALUE) {
                throw new RangeViolationException("attribute '" + name + "' of '" + element.getKind() + "'",
                        wide, Integer.MIN_VALUE, Integer.MAX_VALUE);
            }
            return wide.intValue();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        throw invalidAttribute(element, name, "an integer", value);
    }

    private static int optionalInt(MarkupElement element, String name, int defaultValue)
            throws MarkdownTreeException {
        return element.getAttribute(name) == null ? defaultValue : requireInt(element, name);
    }

    private static boolean optionalBoolean(MarkupElement element, String name, boolean defaultValue)
            throws InvariantViolationException {
        Object value = element.getAttribute(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw invalidAttribute(element, name, "a boolean", value);
    }

    private static InvariantViolationException invalidAttribute(MarkupElement element, String name,
                                                                String expected, Object actual) {
        return new InvariantViolationException("attribute '" + name + "' of '" + element.getKind()
                + "' must be " + expected + ", got " + (actual == null ? "nothing" : "'" + actual + "'"));
    }

    private static String kindOf(Object child) {
        if (child instanceof MarkupElement element) {
            return element.getKind();
        }
        if (child instanceof String) {
            return "text";
        }
        return child == null ? "null" : child.getClass().getSimpleName();
    }
}
