package org.dxworks.mdtree.walk;

import org.dxworks.mdtree.convert.MarkdownConverter;
import org.dxworks.mdtree.model.Admonition;
import org.dxworks.mdtree.model.Block;
import org.dxworks.mdtree.model.BlockQuote;
import org.dxworks.mdtree.model.CodeBlock;
import org.dxworks.mdtree.model.Document;
import org.dxworks.mdtree.model.Emphasis;
import org.dxworks.mdtree.model.Footnote;
import org.dxworks.mdtree.model.FootnoteReference;
import org.dxworks.mdtree.model.Heading;
import org.dxworks.mdtree.model.Image;
import org.dxworks.mdtree.model.InlineMath;
import org.dxworks.mdtree.model.Link;
import org.dxworks.mdtree.model.ListBlock;
import org.dxworks.mdtree.model.Node;
import org.dxworks.mdtree.model.NodeClass;
import org.dxworks.mdtree.model.Paragraph;
import org.dxworks.mdtree.model.Strong;
import org.dxworks.mdtree.model.Table;
import org.dxworks.mdtree.model.TableCell;
import org.dxworks.mdtree.model.Text;
import org.dxworks.mdtree.model.ThematicBreak;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.mdtree.TestUtils.exampleTree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class MarkdownWalkerTest {

    @Test
    void visitsExampleDocumentInPreOrder() throws Exception {
        Document document = new MarkdownConverter().convert(exampleTree());
        List<String> visits = new ArrayList<>();

        MarkdownWalker.walk((nodeClass, node) -> {
            visits.add(nodeClass + " " + TreePrinter.label(node));
            return true;
        }, document);

        assertEquals(List.of(
                "BLOCK Heading level=1",
                "INLINE Text \"Header\"",
                "BLOCK Paragraph",
                "INLINE Text \"Hello \"",
                "INLINE Strong",
                "INLINE Text \"World\"",
                "BLOCK ThematicBreak"), visits);
    }

    @Test
    void visitsEveryNodeExactlyOnce() throws Exception {
        Document document = richDocument();
        List<Node> visited = new ArrayList<>();

        MarkdownWalker.walk((nodeClass, node) -> {
            assertEquals(node.nodeClass(), nodeClass);
            visited.add(node);
            return true;
        }, document);

        int expected = 0;
        for (Block block : document.getNodes()) {
            expected += countNodes(block);
        }
        assertEquals(expected, visited.size());
        assertEquals(26, visited.size());
    }

    @Test
    void prunedBlockQuoteSkipsDescendantsButNotSiblings() throws Exception {
        Document document = new Document(List.of(
                new BlockQuote(List.of(new Paragraph(List.of(new Text("hidden"))))),
                new Paragraph(List.of(new Text("shown")))));
        List<String> visits = new ArrayList<>();

        MarkdownWalker.walk((nodeClass, node) -> {
            visits.add(TreePrinter.label(node));
            return !(node instanceof BlockQuote);
        }, document);

        assertEquals(List.of("BlockQuote", "Paragraph", "Text \"shown\""), visits);
    }

    @Test
    void returningFalseFromLeafChangesNothing() {
        Document document = new Document(List.of(new Paragraph(List.of(new Text("a"), new Text("b")))));
        List<Node> visits = new ArrayList<>();

        MarkdownWalker.walk((nodeClass, node) -> {
            visits.add(node);
            return nodeClass == NodeClass.BLOCK;
        }, document);

        assertEquals(3, visits.size());
    }

    @Test
    void descendsIntoListItemsAndTableCellsInOrder() {
        ListBlock list = new ListBlock(true, 1, true, List.of(
                List.of(new Paragraph(List.of(new Text("i1")))),
                List.of(new Paragraph(List.of(new Text("i2"))), new CodeBlock("", "c"))));
        Table table = new Table(List.of(Table.Alignment.NONE, Table.Alignment.NONE), List.of(
                List.of(new TableCell(List.of(new Text("r0c0"))), new TableCell(List.of(new Text("r0c1")))),
                List.of(new TableCell(List.of(new Text("r1c0"))), new TableCell(List.of(new Text("r1c1"))))));
        List<String> visits = new ArrayList<>();

        MarkdownWalker.walk((nodeClass, node) -> {
            visits.add(TreePrinter.label(node));
            return true;
        }, new Document(List.of(list, table)));

        assertEquals(List.of(
                "List ordered=true start=1 tight=true items=2",
                "Paragraph", "Text \"i1\"",
                "Paragraph", "Text \"i2\"",
                "CodeBlock language=\"\" code=\"c\"",
                "Table alignments=[NONE, NONE] rows=2",
                "Text \"r0c0\"", "Text \"r0c1\"", "Text \"r1c0\"", "Text \"r1c1\""), visits);
    }

    @Test
    void visitorFailureAbortsTheWalk() {
        Document document = new Document(List.of(
                new Paragraph(List.of(new Text("a"))),
                new ThematicBreak(),
                new Paragraph(List.of(new Text("never")))));
        List<Node> visits = new ArrayList<>();
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> MarkdownWalker.walk((nodeClass, node) -> {
                    visits.add(node);
                    if (node instanceof ThematicBreak) {
                        throw failure;
                    }
                    return true;
                }, document));

        assertSame(failure, thrown);
        assertEquals(3, visits.size());
    }

    @Test
    void contextualWalkPassesParents() throws Exception {
        Document document = new MarkdownConverter().convert(exampleTree());
        List<String> edges = new ArrayList<>();

        MarkdownWalker.walkWithContext((context, parent, node) ->
                edges.add((parent == null ? "-" : TreePrinter.label(parent)) + " > " + TreePrinter.label(node)),
                document);

        assertEquals(List.of(
                "- > Heading level=1",
                "Heading level=1 > Text \"Header\"",
                "- > Paragraph",
                "Paragraph > Text \"Hello \"",
                "Paragraph > Strong",
                "Strong > Text \"World\"",
                "- > ThematicBreak"), edges);
    }

    @Test
    void contextValuesReachDescendantsButNotSiblings() {
        Document document = new Document(List.of(
                new Footnote("fn", List.of(new Paragraph(List.of(new Text("inside"))))),
                new Paragraph(List.of(new Text("outside")))));
        List<String> seen = new ArrayList<>();

        MarkdownWalker.walkWithContext((context, parent, node) -> {
            if (node instanceof Text text) {
                seen.add(text.text() + "=" + context.getOrDefault("footnote", String.class, "none"));
            }
            if (node instanceof Footnote footnote) {
                context.put("footnote", footnote.id());
            }
        }, document);

        assertEquals(List.of("inside=fn", "outside=none"), seen);
    }

    static Document richDocument() throws Exception {
        return new Document(List.of(
                Heading.of(2, List.of(new Text("Title"), new Emphasis(List.of(new Text("em"))))),
                new BlockQuote(List.of(
                        new Paragraph(List.of(new Link("u", List.of(new Strong(List.of(new Text("s"))))))),
                        new Admonition("note", "t", List.of(new Paragraph(List.of(new InlineMath("x"))))))),
                new ListBlock(false, 1, true, List.of(
                        List.of(new Paragraph(List.of(new Text("a")))),
                        List.of(new Paragraph(List.of(new Image("i.png", "", List.of(new Text("alt")))))))),
                new Table(List.of(Table.Alignment.LEFT), List.of(
                        List.of(new TableCell(List.of(new Text("h")))),
                        List.of(new TableCell(List.of(new Text("c"), FootnoteReference.of("1")))))),
                new Footnote("1", List.of(new Paragraph(List.of(new Text("note"))))),
                new ThematicBreak()));
    }

    private static int countNodes(Node node) {
        if (node instanceof Heading heading) {
            return 1 + countAll(heading.nodes());
        }
        if (node instanceof Paragraph paragraph) {
            return 1 + countAll(paragraph.nodes());
        }
        if (node instanceof BlockQuote quote) {
            return 1 + countAll(quote.nodes());
        }
        if (node instanceof Admonition admonition) {
            return 1 + countAll(admonition.nodes());
        }
        if (node instanceof Footnote footnote) {
            return 1 + countAll(footnote.nodes());
        }
        if (node instanceof ListBlock list) {
            int count = 1;
            for (List<Block> item : list.items()) {
                count += countAll(item);
            }
            return count;
        }
        if (node instanceof Table table) {
            int count = 1;
            for (List<TableCell> row : table.rows()) {
                for (TableCell cell : row) {
                    count += countAll(cell.nodes());
                }
            }
            return count;
        }
        if (node instanceof Emphasis emphasis) {
            return 1 + countAll(emphasis.nodes());
        }
        if (node instanceof Strong strong) {
            return 1 + countAll(strong.nodes());
        }
        if (node instanceof Link link) {
            return 1 + countAll(link.nodes());
        }
        if (node instanceof Image image) {
            return 1 + countAll(image.alt());
        }
        return 1;
    }

    private static int countAll(List<? extends Node> nodes) {
        int count = 0;
        for (Node node : nodes) {
            count += countNodes(node);
        }
        return count;
    }
}
