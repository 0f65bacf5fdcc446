package org.dxworks.mdtree;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.mdtree.convert.MarkdownConverter;
import org.dxworks.mdtree.markup.CommonmarkReader;
import org.dxworks.mdtree.model.Document;
import org.dxworks.mdtree.model.MarkdownTreeException;
import org.dxworks.mdtree.walk.TreePrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar mdtree.jar <input> [<output-file>]");
            System.err.println("  <input>:       Markdown file or directory containing Markdown files");
            System.err.println("  <output-file>: Path to output JSONL file; without it, outlines are printed");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        MdtreeConfig config = MdtreeConfig.load();
        List<Path> files = collectMarkdownFiles(input, config.getMaxFileLines());

        if (args.length < 2) {
            printOutlines(files, config);
            return;
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Converting Markdown files...");
        System.out.println("Input: " + input.toAbsolutePath());
        System.out.println("Found " + files.size() + " Markdown files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // each document is converted by exactly one thread
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                try {
                    Document document = convertFile(file, config);
                    Map<String, Object> record = new HashMap<>();
                    record.put("kind", "document");
                    record.put("file", file.toString());
                    record.put("document", document);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(record));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (IOException | MarkdownTreeException e) {
                    writeError(writer, file, e);
                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static void printOutlines(List<Path> files, MdtreeConfig config) {
        for (Path file : files) {
            System.out.println("# " + file);
            try {
                System.out.print(TreePrinter.print(convertFile(file, config)));
            } catch (IOException | MarkdownTreeException e) {
                System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
            }
        }
    }

    private static void writeError(BufferedWriter writer, Path file, Exception e) {
        Map<String, String> error = new HashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("error_type", e.getClass().getSimpleName());
        error.put("error", e.getMessage());
        try {
            synchronized (writer) {
                writer.write(MAPPER.writeValueAsString(error));
                writer.newLine();
                writer.flush();
            }
        } catch (IOException ioException) {
            System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
        }
    }

    static List<Path> collectMarkdownFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isMarkdownFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && withinMaxLines(input, maxFileLines)) {
            files.add(input);
        }
        return files;
    }

    static boolean isMarkdownFile(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".md") || fileName.endsWith(".markdown");
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            return true;
        }
    }

    public static Document convertFile(Path filePath, MdtreeConfig config) throws IOException, MarkdownTreeException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }
        return convert(source, config);
    }

    public static Document convert(String markdown, MdtreeConfig config) throws MarkdownTreeException {
        CommonmarkReader reader = new CommonmarkReader(config.getMathFenceInfo());
        return new MarkdownConverter().convert(reader.read(markdown));
    }
}
