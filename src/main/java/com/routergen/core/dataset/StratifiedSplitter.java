package com.routergen.core.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.core.example.Example;
import com.routergen.core.format.ChatTemplateRenderer;
import com.routergen.core.schema.ToolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Train/test split stratified by tool kind, with a seeded shuffle, and
 * writer for the formatted {"text": ...} JSONL files consumed by training.
 */
@Component
public class StratifiedSplitter {

    private static final Logger log = LoggerFactory.getLogger(StratifiedSplitter.class);

    private final ChatTemplateRenderer renderer;
    private final ObjectMapper         objectMapper;

    public StratifiedSplitter(ChatTemplateRenderer renderer, ObjectMapper objectMapper) {
        this.renderer     = renderer;
        this.objectMapper = objectMapper;
    }

    public SplitResult split(List<Example> examples, double trainRatio, long seed) {
        if (trainRatio <= 0 || trainRatio >= 1) {
            throw new IllegalArgumentException("trainRatio must be in (0, 1), got " + trainRatio);
        }
        Random random = new Random(seed);

        Map<ToolKind, List<Example>> byKind = new EnumMap<>(ToolKind.class);
        for (Example e : examples) {
            byKind.computeIfAbsent(e.getToolCall().getKind(), k -> new ArrayList<>()).add(e);
        }

        List<Example> train = new ArrayList<>();
        List<Example> test  = new ArrayList<>();
        for (Map.Entry<ToolKind, List<Example>> group : byKind.entrySet()) {
            List<Example> items = group.getValue();
            Collections.shuffle(items, random);
            int cut = (int) (items.size() * trainRatio);
            train.addAll(items.subList(0, cut));
            test.addAll(items.subList(cut, items.size()));
            log.debug("[Split] {}: {} train / {} test", group.getKey().getTag(), cut, items.size() - cut);
        }

        Collections.shuffle(train, random);
        Collections.shuffle(test, random);
        log.info("[Split] {} examples -> {} train / {} test (ratio {}, seed {})",
                examples.size(), train.size(), test.size(), trainRatio, seed);
        return new SplitResult(train, test);
    }

    /** Write one {"text": rendered} line per example, replacing the file. */
    public void writeFormatted(List<Example> examples, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                for (Example e : examples) {
                    writer.write(objectMapper.valueToTree(Map.of("text", renderer.render(e))).toString());
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new DatasetIOException("Failed to write " + output, e);
        }
        log.info("[Split] Saved {} examples to {}", examples.size(), output);
    }
}
