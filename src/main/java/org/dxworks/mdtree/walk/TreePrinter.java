package org.dxworks.mdtree.walk;

import org.dxworks.mdtree.model.Admonition;
import org.dxworks.mdtree.model.Block;
import org.dxworks.mdtree.model.BlockQuote;
import org.dxworks.mdtree.model.BlockVisitor;
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
import org.dxworks.mdtree.model.InlineVisitor;
import org.dxworks.mdtree.model.LineBreak;
import org.dxworks.mdtree.model.Link;
import org.dxworks.mdtree.model.ListBlock;
import org.dxworks.mdtree.model.Node;
import org.dxworks.mdtree.model.Paragraph;
import org.dxworks.mdtree.model.Strong;
import org.dxworks.mdtree.model.Table;
import org.dxworks.mdtree.model.TableCell;
import org.dxworks.mdtree.model.Text;
import org.dxworks.mdtree.model.ThematicBreak;

import java.util.List;

/**
 * Renders a document as an indented outline, one node per line.
 * <p>
 * List items and table rows and cells get marker lines of their own, so the outline shows where
 * one item ends and the next begins.
 */
public final class TreePrinter {

    private static final String INDENT = "  ";

    private static final BlockVisitor<String> BLOCK_LABELS = new BlockLabels();
    private static final InlineVisitor<String> INLINE_LABELS = new InlineLabels();

    private TreePrinter() {
    }

    public static String print(Document document) {
        StringBuilder out = new StringBuilder();
        for (Block block : document.getNodes()) {
            print(out, block, 0);
        }
        return out.toString();
    }

    private static void print(StringBuilder out, Node node, int depth) {
        line(out, depth, label(node));
        if (node instanceof ListBlock list) {
            int number = 1;
            for (List<Block> item : list.items()) {
                line(out, depth + 1, "Item " + number++);
                for (Block block : item) {
                    print(out, block, depth + 2);
                }
            }
        } else if (node instanceof Table table) {
            int number = 1;
            for (List<TableCell> row : table.rows()) {
                line(out, depth + 1, "Row " + number++);
                for (TableCell cell : row) {
                    line(out, depth + 2, "Cell");
                    for (Inline inline : cell.nodes()) {
                        print(out, inline, depth + 3);
                    }
                }
            }
        } else {
            for (Node child : MarkdownWalker.childrenOf(node)) {
                print(out, child, depth + 1);
            }
        }
    }

    private static void line(StringBuilder out, int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }

    public static String label(Node node) {
        if (node instanceof Block block) {
            return block.accept(BLOCK_LABELS);
        }
        return ((Inline) node).accept(INLINE_LABELS);
    }

    static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    private static final class BlockLabels implements BlockVisitor<String> {

        @Override
        public String visit(ThematicBreak thematicBreak) {
            return "ThematicBreak";
        }

        @Override
        public String visit(Heading heading) {
            return "Heading level=" + heading.level();
        }

        @Override
        public String visit(CodeBlock codeBlock) {
            return "CodeBlock language=" + quote(codeBlock.language()) + " code=" + quote(codeBlock.code());
        }

        @Override
        public String visit(Paragraph paragraph) {
            return "Paragraph";
        }

        @Override
        public String visit(BlockQuote blockQuote) {
            return "BlockQuote";
        }

        @Override
        public String visit(ListBlock list) {
            String label = "List ordered=" + list.ordered();
            if (list.ordered()) {
                label += " start=" + list.start();
            }
            return label + " tight=" + list.tight() + " items=" + list.items().size();
        }

        @Override
        public String visit(DisplayMath displayMath) {
            return "DisplayMath " + quote(displayMath.formula());
        }

        @Override
        public String visit(Footnote footnote) {
            return "Footnote id=" + quote(footnote.id());
        }

        @Override
        public String visit(Table table) {
            return "Table alignments=" + table.alignments() + " rows=" + table.rows().size();
        }

        @Override
        public String visit(Admonition admonition) {
            return "Admonition category=" + quote(admonition.category()) + " title=" + quote(admonition.title());
        }
    }

    private static final class InlineLabels implements InlineVisitor<String> {

        @Override
        public String visit(Text text) {
            return "Text " + quote(text.text());
        }

        @Override
        public String visit(CodeSpan codeSpan) {
            return "CodeSpan " + quote(codeSpan.code());
        }

        @Override
        public String visit(Emphasis emphasis) {
            return "Emphasis";
        }

        @Override
        public String visit(Strong strong) {
            return "Strong";
        }

        @Override
        public String visit(Link link) {
            return "Link destination=" + quote(link.destination());
        }

        @Override
        public String visit(Image image) {
            return "Image destination=" + quote(image.destination()) + " title=" + quote(image.title());
        }

        @Override
        public String visit(LineBreak lineBreak) {
            return "LineBreak";
        }

        @Override
        public String visit(InlineMath inlineMath) {
            return "InlineMath " + quote(inlineMath.formula());
        }

        @Override
        public String visit(FootnoteReference footnoteReference) {
            return "FootnoteReference id=" + quote(footnoteReference.id());
        }
    }
}
