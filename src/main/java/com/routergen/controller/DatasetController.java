package com.routergen.controller;

import com.routergen.config.PipelineConfig;
import com.routergen.core.dataset.AuditReport;
import com.routergen.core.dataset.DatasetAuditor;
import com.routergen.core.dataset.DatasetIOException;
import com.routergen.core.dataset.SplitResult;
import com.routergen.core.dataset.StratifiedSplitter;
import com.routergen.orchestrator.GenerationReport;
import com.routergen.orchestrator.PipelineOrchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/datasets")
public class DatasetController {

    private static final Logger log = LoggerFactory.getLogger(DatasetController.class);

    private static final double DEFAULT_TRAIN_RATIO = 0.9;

    private final PipelineOrchestrator orchestrator;
    private final PipelineConfig       config;
    private final DatasetAuditor       auditor;
    private final StratifiedSplitter   splitter;

    public DatasetController(PipelineOrchestrator orchestrator, PipelineConfig config,
                             DatasetAuditor auditor, StratifiedSplitter splitter) {
        this.orchestrator = orchestrator;
        this.config       = config;
        this.auditor      = auditor;
        this.splitter     = splitter;
    }

    /**
     * Body (all optional): {"target": 200, "seed": 7, "records": "data/raw/run.jsonl"}
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerationReport> generate(
            @RequestBody(required = false) Map<String, Object> request
    ) {
        PipelineConfig runConfig;
        try {
            runConfig = withOverrides(request == null ? Map.of() : request);
        } catch (IllegalArgumentException e) {
            log.warn("[Controller] Rejected generate request: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }

        if (orchestrator.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }

        GenerationReport report = orchestrator.run(runConfig);
        return ResponseEntity.ok(report);
    }

    /**
     * Body: {"path": "data/raw/router_dataset.jsonl", "splitDir": "data/split", "trainRatio": 0.9}
     * splitDir is optional; when present the valid examples are split and
     * written as train.jsonl / test.jsonl.
     */
    @PostMapping("/audit")
    public ResponseEntity<Map<String, Object>> audit(
            @RequestBody Map<String, Object> request
    ) {
        Object rawPath = request.get("path");
        if (rawPath == null || rawPath.toString().trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        Path file = Paths.get(rawPath.toString().trim());
        if (!Files.isRegularFile(file)) {
            return ResponseEntity.notFound().build();
        }

        AuditReport report;
        try {
            report = auditor.audit(file);
        } catch (DatasetIOException e) {
            log.error("[Controller] Audit of {} failed", file, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("file", file.toString());
        body.put("total", report.getTotal());
        body.put("valid", report.getValid());
        body.put("invalid", report.getInvalid());
        body.put("duplicates", report.getDuplicates());
        body.put("validRatio", report.validRatio());
        body.put("rejectedByReason", report.getRejectedByReason());
        body.put("validByKind", report.getValidByKind());
        body.put("sampleIssues", report.getSampleIssues());

        Object splitDir = request.get("splitDir");
        if (splitDir != null && !splitDir.toString().isBlank()) {
            double ratio = request.get("trainRatio") instanceof Number
                    ? ((Number) request.get("trainRatio")).doubleValue()
                    : DEFAULT_TRAIN_RATIO;
            if (ratio <= 0 || ratio >= 1) {
                return ResponseEntity.badRequest().build();
            }
            Path dir = Paths.get(splitDir.toString().trim());
            SplitResult split = splitter.split(report.getValidExamples(), ratio, config.getSeed());
            splitter.writeFormatted(split.getTrain(), dir.resolve("train.jsonl"));
            splitter.writeFormatted(split.getTest(), dir.resolve("test.jsonl"));
            body.put("train", split.getTrain().size());
            body.put("test", split.getTest().size());
        }
        return ResponseEntity.ok(body);
    }

    private PipelineConfig withOverrides(Map<String, Object> request) {
        PipelineConfig.Builder builder = config.toBuilder();
        Object target = request.get("target");
        if (target != null) {
            builder.totalTarget(asInt("target", target));
        }
        Object seed = request.get("seed");
        if (seed != null) {
            builder.seed(asInt("seed", seed));
        }
        Object records = request.get("records");
        if (records != null && !records.toString().isBlank()) {
            builder.recordsPath(Paths.get(records.toString().trim()));
        }
        return builder.build();
    }

    private static int asInt(String name, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value);
        }
    }
}
