package org.dxworks.mdtree;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.mdtree.convert.UnsupportedNodeKindException;
import org.dxworks.mdtree.model.CodeBlock;
import org.dxworks.mdtree.model.DisplayMath;
import org.dxworks.mdtree.model.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void collectsMarkdownFilesWithinLineLimit() throws IOException {
        Files.writeString(tempDir.resolve("a.md"), "# a\n");
        Files.writeString(tempDir.resolve("b.MARKDOWN"), "# b\n");
        Files.writeString(tempDir.resolve("long.md"), "1\n2\n3\n4\n");
        Files.writeString(tempDir.resolve("notes.txt"), "x\n");

        List<Path> files = App.collectMarkdownFiles(tempDir, 3);

        assertEquals(List.of(tempDir.resolve("a.md"), tempDir.resolve("b.MARKDOWN")), files);
        assertTrue(App.isMarkdownFile(tempDir.resolve("README.md")));
        assertFalse(App.isMarkdownFile(tempDir.resolve("notes.txt")));
    }

    @Test
    void convertsWithConfiguredMathFence() throws Exception {
        String markdown = "```math\nx\n```\n";

        Document defaults = App.convert(markdown, MdtreeConfig.defaults());
        Document disabled = App.convert(markdown, MdtreeConfig.with(100, ""));

        assertEquals(new DisplayMath("x"), defaults.get(0));
        assertEquals(new CodeBlock("math", "x"), disabled.get(0));
    }

    @Test
    void stripsByteOrderMark() throws Exception {
        Path file = tempDir.resolve("bom.md");
        Files.writeString(file, "\uFEFF# Title\n");

        Document document = App.convertFile(file, MdtreeConfig.defaults());

        assertEquals(1, document.size());
    }

    @Test
    void rawHtmlIsRejected() {
        assertThrows(UnsupportedNodeKindException.class,
                () -> App.convert("text <span>html</span>\n", MdtreeConfig.defaults()));
    }

    @Test
    void serializesDocumentsWithTypeNames() throws Exception {
        Document document = App.convert("# Hi\n\n---\n", MdtreeConfig.defaults());

        JsonNode json = App.MAPPER.valueToTree(document);

        JsonNode nodes = json.get("nodes");
        assertEquals(2, nodes.size());
        assertEquals("Heading", nodes.get(0).get("type").asText());
        assertEquals(1, nodes.get(0).get("level").asInt());
        assertEquals("Text", nodes.get(0).get("nodes").get(0).get("type").asText());
        assertEquals("Hi", nodes.get(0).get("nodes").get(0).get("text").asText());
        assertEquals("ThematicBreak", nodes.get(1).get("type").asText());
    }

    @Test
    void serializesCodeSpansAndFootnoteReferencesByField() throws Exception {
        Document document = App.convert("Say `x`[^1]\n\n[^1]: note\n", MdtreeConfig.defaults());

        JsonNode inlines = App.MAPPER.valueToTree(document).get("nodes").get(0).get("nodes");

        assertEquals("CodeSpan", inlines.get(1).get("type").asText());
        assertEquals("x", inlines.get(1).get("code").asText());
        assertEquals("FootnoteReference", inlines.get(2).get("type").asText());
        assertEquals("1", inlines.get(2).get("id").asText());
    }
}
