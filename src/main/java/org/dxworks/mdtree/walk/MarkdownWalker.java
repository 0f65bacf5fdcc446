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

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-order, depth-first traversal of the Markdown AST in sibling order.
 * <p>
 * Every node is visited exactly once. Exceptions thrown by a visitor are not caught: the walk
 * stops there and the exception reaches the caller as is. The walker does no synchronization,
 * so a document must not be walked and mutated concurrently.
 */
public final class MarkdownWalker {

    private static final BlockVisitor<List<? extends Node>> BLOCK_CHILDREN = new BlockChildren();
    private static final InlineVisitor<List<? extends Node>> INLINE_CHILDREN = new InlineChildren();

    private MarkdownWalker() {
    }

    public static void walk(NodeVisitor visitor, Document document) {
        walk(visitor, document.getNodes());
    }

    public static void walk(NodeVisitor visitor, List<? extends Node> nodes) {
        for (Node node : nodes) {
            walk(visitor, node);
        }
    }

    public static void walk(NodeVisitor visitor, Node node) {
        if (visitor.visit(node.nodeClass(), node)) {
            walk(visitor, childrenOf(node));
        }
    }

    /**
     * Walks every node of the document, handing each one its parent and a copy of the parent's
     * context. Top-level blocks have a {@code null} parent.
     */
    public static void walkWithContext(ContextualVisitor<Node> visitor, Document document) {
        WalkContext root = new WalkContext();
        for (Block block : document.getNodes()) {
            walkWithContext(visitor, root, null, block);
        }
    }

    private static void walkWithContext(ContextualVisitor<Node> visitor, WalkContext context, Node parent, Node node) {
        WalkContext scope = context.copy();
        visitor.visit(scope, parent, node);
        for (Node child : childrenOf(node)) {
            walkWithContext(visitor, scope, node, child);
        }
    }

    /**
     * Direct children of a node in walk order. List items and table cells are flattened.
     */
    public static List<? extends Node> childrenOf(Node node) {
        if (node instanceof Block block) {
            return block.accept(BLOCK_CHILDREN);
        }
        return ((Inline) node).accept(INLINE_CHILDREN);
    }

    private static final class BlockChildren implements BlockVisitor<List<? extends Node>> {

        @Override
        public List<? extends Node> visit(ThematicBreak thematicBreak) {
            return List.of();
        }

        @Override
        public List<? extends Node> visit(Heading heading) {
            return heading.nodes();
        }

        @Override
        public List<? extends Node> visit(CodeBlock codeBlock) {
            return List.of();
        }

        @Override
        public List<? extends Node> visit(Paragraph paragraph) {
            return paragraph.nodes();
        }

        @Override
        public List<? extends Node> visit(BlockQuote blockQuote) {
            return blockQuote.nodes();
        }

        @Override
        public List<? extends Node> visit(ListBlock list) {
            List<Block> blocks = new ArrayList<>();
            for (List<Block> item : list.items()) {
                blocks.addAll(item);
            }
            return blocks;
        }

        @Override
        public List<? extends Node> visit(DisplayMath displayMath) {
            return List.of();
        }

        @Override
        public List<? extends Node> visit(Footnote footnote) {
            return footnote.nodes();
        }

        @Override
        public List<? extends Node> visit(Table table) {
            // row-major
            List<Inline> inlines = new ArrayList<>();
            for (List<TableCell> row : table.rows()) {
                for (TableCell cell : row) {
                    inlines.addAll(cell.nodes());
                }
            }
            return inlines;
        }

        @Override
        public List<? extends Node> visit(Admonition admonition) {
            return admonition.nodes();
        }
    }

    private static final class InlineChildren implements InlineVisitor<List<? extends Node>> {

        @Override
        public List<? extends Node> visit(Text text) {
            return List.of();
        }

        @Override
        public List<? extends Node> visit(CodeSpan codeSpan) {
            return List.of();
        }

        @Override
        public List<? extends Node> visit(Emphasis emphasis) {
            return emphasis.nodes();
        }

        @Override
        public List<? extends Node> visit(Strong strong) {
            return strong.nodes();
        }

        @Override
        public List<? extends Node> visit(Link link) {
            return link.nodes();
        }

        @Override
        public List<? extends Node> visit(Image image) {
            return image.alt();
        }

        @Override
        public List<? extends Node> visit(LineBreak lineBreak) {
            return List.of();
        }

        @Override
        public List<? extends Node> visit(InlineMath inlineMath) {
            return List.of();
        }

        @Override
        public List<? extends Node> visit(FootnoteReference footnoteReference) {
            return List.of();
        }
    }
}
