package com.routergen.core.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.core.dedup.Fingerprint;
import com.routergen.core.dedup.NullFieldStripper;
import com.routergen.core.example.Example;
import com.routergen.core.example.ExampleCodec;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.ToolKind;
import com.routergen.core.validator.RejectionReason;
import com.routergen.core.validator.ValidationOutcome;
import com.routergen.core.validator.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Re-validates a persisted JSONL dataset without modifying it and reports
 * counts per rejection reason, per tool kind and duplicates.
 *
 * Each line is checked against the tool it declares; domain and persona are
 * taken from the line itself.
 */
@Component
public class DatasetAuditor {

    private static final Logger log = LoggerFactory.getLogger(DatasetAuditor.class);

    static final int MAX_SAMPLE_ISSUES = 20;

    private final Validator         validator;
    private final NullFieldStripper stripper;
    private final ObjectMapper      objectMapper;

    public DatasetAuditor(Validator validator, NullFieldStripper stripper, ObjectMapper objectMapper) {
        this.validator    = validator;
        this.stripper     = stripper;
        this.objectMapper = objectMapper;
    }

    public AuditReport audit(Path file) {
        if (!Files.exists(file)) {
            throw new DatasetIOException("Dataset not found: " + file, null);
        }
        log.info("[Audit] Starting audit of {}", file);

        int total = 0;
        int duplicates = 0;
        Map<RejectionReason, Integer> rejected = new EnumMap<>(RejectionReason.class);
        Map<ToolKind, Integer> byKind = new EnumMap<>(ToolKind.class);
        List<String> issues = new ArrayList<>();
        List<Example> valid = new ArrayList<>();
        Set<Fingerprint> seen = new HashSet<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                total++;

                ValidationOutcome outcome = validator.validate(line, taskFor(lineNo, line));
                if (!outcome.isAccepted()) {
                    rejected.merge(outcome.getReason(), 1, Integer::sum);
                    addIssue(issues, lineNo, outcome.getReason() + " " + outcome.getDetails());
                    continue;
                }

                Example example = stripper.strip(outcome.getExample());
                if (!seen.add(Fingerprint.of(example))) {
                    duplicates++;
                    addIssue(issues, lineNo, "duplicate of an earlier line");
                    continue;
                }
                byKind.merge(outcome.getRoutingTag(), 1, Integer::sum);
                valid.add(example);
            }
        } catch (IOException e) {
            throw new DatasetIOException("Failed to read " + file, e);
        }

        AuditReport report = new AuditReport(file, total, duplicates, rejected, byKind, issues, valid);
        log.info("[Audit] {} | total={} | valid={} ({}%) | duplicates={} | rejected={} | byKind={}",
                file.getFileName(), total, report.getValid(),
                String.format("%.2f", report.validRatio() * 100), duplicates, rejected, byKind);
        return report;
    }

    /** Reconstruct the task a persisted line claims to answer. */
    private GenerationTask taskFor(int lineNo, String line) {
        String domain = null;
        String persona = null;
        ToolKind kind = ToolKind.CODEBASE_SEARCH;
        try {
            JsonNode root = objectMapper.readTree(line);
            domain  = root.path(ExampleCodec.FIELD_DOMAIN).asText(null);
            persona = root.path(ExampleCodec.FIELD_PERSONA).asText(null);
            String tag = root.path(ExampleCodec.FIELD_TOOL_CALL).path(SchemaRegistry.DISCRIMINATOR_FIELD).asText("");
            kind = ToolKind.fromTag(tag).orElse(kind);
        } catch (IOException e) {
            // unparseable lines are reported by the Validator
            log.debug("[Audit] line {} is not JSON: {}", lineNo, e.getMessage());
        }
        return new GenerationTask(lineNo, domain, persona, kind, "audit");
    }

    private static void addIssue(List<String> issues, int lineNo, String issue) {
        if (issues.size() < MAX_SAMPLE_ISSUES) {
            issues.add("line " + lineNo + ": " + issue);
        }
    }
}
