package com.routergen.core.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.config.ValidationPolicy;
import com.routergen.core.dedup.NullFieldStripper;
import com.routergen.core.example.Example;
import com.routergen.core.example.ExampleCodec;
import com.routergen.core.format.Llama3ChatTemplateRenderer;
import com.routergen.core.schema.AskHumanCall;
import com.routergen.core.schema.SandboxExecCall;
import com.routergen.core.schema.ToolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StratifiedSplitterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private StratifiedSplitter splitter;

    @BeforeEach
    void setUp() {
        Llama3ChatTemplateRenderer renderer = new Llama3ChatTemplateRenderer(
                new ExampleCodec(mapper), new NullFieldStripper(ValidationPolicy.defaults()), mapper);
        splitter = new StratifiedSplitter(renderer, mapper);
    }

    @Test
    void testEachKindSplitByRatio() {
        List<Example> examples = new ArrayList<>();
        for (int i = 0; i < 20; i++) examples.add(sandbox(i));
        for (int i = 0; i < 10; i++) examples.add(askHuman(i));

        SplitResult split = splitter.split(examples, 0.8, 42);

        assertEquals(24, split.getTrain().size());
        assertEquals(6, split.getTest().size());
        assertEquals(16, count(split.getTrain(), ToolKind.SANDBOX_EXEC));
        assertEquals(8, count(split.getTrain(), ToolKind.ASK_HUMAN));

        Set<Example> all = new HashSet<>(split.getTrain());
        all.addAll(split.getTest());
        assertEquals(new HashSet<>(examples), all);
    }

    @Test
    void testSameSeedSameSplit() {
        List<Example> examples = new ArrayList<>();
        for (int i = 0; i < 30; i++) examples.add(sandbox(i));

        assertEquals(splitter.split(examples, 0.9, 7).getTest(), splitter.split(examples, 0.9, 7).getTest());
    }

    @Test
    void testRatioOutsideOpenIntervalRejected() {
        assertThrows(IllegalArgumentException.class, () -> splitter.split(List.of(), 1.0, 1));
        assertThrows(IllegalArgumentException.class, () -> splitter.split(List.of(), 0.0, 1));
    }

    @Test
    void testWriteFormattedWritesOneTextLinePerExample() throws Exception {
        Path out = tempDir.resolve("split/train.jsonl");

        splitter.writeFormatted(List.of(sandbox(1), askHuman(2)), out);

        List<String> lines = Files.readAllLines(out);
        assertEquals(2, lines.size());
        assertTrue(mapper.readTree(lines.get(0)).get("text").asText().startsWith("<|start_header_id|>system"));
    }

    private static long count(List<Example> examples, ToolKind kind) {
        return examples.stream().filter(e -> e.getToolCall().getKind() == kind).count();
    }

    private static Example sandbox(int i) {
        return new Example("What does " + i + " * 3 print in Python?",
                "A small computation, so I will run the snippet in the sandbox and read the output.",
                new SandboxExecCall("print(" + i + " * 3)", null), "Smart Grid Controller", "SRE");
    }

    private static Example askHuman(int i) {
        return new Example("Delete tenant " + i + " and all of its data",
                "Deleting tenant data cannot be undone, so I will ask a human to confirm first.",
                new AskHumanCall("Should tenant " + i + " really be deleted?", null), "Smart Grid Controller", "SRE");
    }
}
