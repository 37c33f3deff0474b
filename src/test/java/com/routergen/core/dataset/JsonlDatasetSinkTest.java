package com.routergen.core.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.core.example.Example;
import com.routergen.core.example.ExampleCodec;
import com.routergen.core.schema.SandboxExecCall;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonlDatasetSinkTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExampleCodec codec  = new ExampleCodec(mapper);

    @Test
    void testWritesRecordAndFormattedLines() throws Exception {
        Path records   = tempDir.resolve("raw/records.jsonl");
        Path formatted = tempDir.resolve("processed/formatted.jsonl");

        try (JsonlDatasetSink sink = JsonlDatasetSink.open(records, formatted, codec, mapper)) {
            sink.write(example(1), "<rendered 1>");
            sink.write(example(2), "<rendered 2>");
            assertEquals(2, sink.written());
        }

        List<String> recordLines = Files.readAllLines(records, StandardCharsets.UTF_8);
        assertEquals(2, recordLines.size());

        JsonNode first = mapper.readTree(recordLines.get(0));
        assertEquals("Quick check: what is 1 squared?", first.get("query").asText());
        assertEquals("sandbox_exec", first.path("toolCall").path("tool_name").asText());
        assertEquals("Genomics Processing Pipeline", first.get("domain").asText());
        assertFalse(first.path("toolCall").path("arguments").has("timeout"));

        List<String> textLines = Files.readAllLines(formatted, StandardCharsets.UTF_8);
        assertEquals("<rendered 2>", mapper.readTree(textLines.get(1)).get("text").asText());
    }

    @Test
    void testOpenTruncatesPreviousOutput() throws Exception {
        Path records = tempDir.resolve("records.jsonl");
        Files.writeString(records, "stale line\nanother\n");

        try (JsonlDatasetSink sink = JsonlDatasetSink.open(records, null, codec, mapper)) {
            sink.write(example(3), "ignored");
        }

        assertEquals(1, Files.readAllLines(records).size());
    }

    @Test
    void testConcurrentWritesProduceWholeLines() throws Exception {
        Path records = tempDir.resolve("records.jsonl");
        int n = 200;

        try (JsonlDatasetSink sink = JsonlDatasetSink.open(records, null, codec, mapper)) {
            ExecutorService executor = Executors.newFixedThreadPool(6);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                int id = i;
                futures.add(executor.submit(() -> sink.write(example(id), "r")));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();
        }

        List<String> lines = Files.readAllLines(records);
        assertEquals(n, lines.size());
        for (String line : lines) {
            assertTrue(mapper.readTree(line).has("toolCall"), "torn line: " + line);
        }
    }

    @Test
    void testFailedFormattedAppendLeavesNeitherLine() throws Exception {
        Path records = tempDir.resolve("records.jsonl");
        FailingLineFile formatted = new FailingLineFile();

        try (JsonlDatasetSink sink = new JsonlDatasetSink(codec, mapper, records,
                LineFile.open(records), formatted)) {
            sink.write(example(1), "first");
            formatted.failNext = true;

            assertThrows(DatasetIOException.class, () -> sink.write(example(2), "second"));
            assertEquals(1, sink.written());
            assertEquals(List.of("first"), formatted.lines);

            sink.write(example(3), "third");
        }

        List<String> lines = Files.readAllLines(records);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("what is 1 squared"));
        assertTrue(lines.get(1).contains("what is 3 squared"));
        assertEquals(List.of("first", "third"), formatted.lines);
    }

    @Test
    void testUnwritableLocationFailsOnOpen() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");

        assertThrows(DatasetIOException.class,
                () -> JsonlDatasetSink.open(blocker.resolve("records.jsonl"), null, codec, mapper));
    }

    private static Example example(int i) {
        return new Example("Quick check: what is " + i + " squared?",
                "A tiny calculation, so I will run it in the sandbox and read the printed value.",
                new SandboxExecCall("print(" + i + " ** 2)", null),
                "Genomics Processing Pipeline", "Data Scientist");
    }

    /** In-memory formatted file whose next append can be made to fail halfway. */
    private static final class FailingLineFile implements LineFile {

        final List<String> lines = new ArrayList<>();
        boolean failNext;

        @Override
        public long size() {
            return lines.size();
        }

        @Override
        public void append(String line) throws IOException {
            String text = new ObjectMapper().readTree(line).get("text").asText();
            if (failNext) {
                failNext = false;
                lines.add(text.substring(0, 2));
                throw new IOException("disk full");
            }
            lines.add(text);
        }

        @Override
        public void truncate(long size) {
            while (lines.size() > size) {
                lines.remove(lines.size() - 1);
            }
        }

        @Override
        public void close() {
        }
    }
}
