package com.routergen.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.communication.InMemoryEventBus;
import com.routergen.config.PipelineConfig;
import com.routergen.config.PoolSettings;
import com.routergen.config.ValidationPolicy;
import com.routergen.core.backend.Backend;
import com.routergen.core.backend.BackendPool;
import com.routergen.core.backend.BackendTag;
import com.routergen.core.backend.RoundRobinStrategy;
import com.routergen.core.dataset.DatasetIOException;
import com.routergen.core.dedup.Deduplicator;
import com.routergen.core.dedup.NullFieldStripper;
import com.routergen.core.event.EventType;
import com.routergen.core.example.ExampleCodec;
import com.routergen.core.format.Llama3ChatTemplateRenderer;
import com.routergen.core.generator.Generator;
import com.routergen.core.generator.PromptBuilder;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.ToolKind;
import com.routergen.core.validator.Validator;
import com.routergen.llm.BackendErrorKind;
import com.routergen.llm.LLMClient;
import com.routergen.llm.MockLLMClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PipelineOrchestratorTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper     mapper = new ObjectMapper();
    private final ValidationPolicy policy = ValidationPolicy.defaults();
    private final List<String>     calls  = Collections.synchronizedList(new ArrayList<>());

    private SchemaRegistry    registry;
    private NullFieldStripper stripper;
    private ExampleCodec      codec;
    private InMemoryEventBus  bus;
    private List<EventType>   events;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry(policy);
        stripper = new NullFieldStripper(policy);
        codec    = new ExampleCodec(mapper);
        bus      = new InMemoryEventBus();
        events   = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(event -> events.add(event.getType()));
    }

    // =========================================================================
    // Happy path
    // =========================================================================

    @Test
    void testRunFillsEveryQuotaAndWritesBothFiles() throws IOException {
        PipelineConfig config = baseConfig(10)
                .variantWeight(ToolKind.CODEBASE_SEARCH, 0.35)
                .variantWeight(ToolKind.SANDBOX_EXEC, 0.24)
                .variantWeight(ToolKind.FILE_MANAGER, 0.18)
                .variantWeight(ToolKind.ASK_HUMAN, 0.08)
                .workerCount(3)
                .formattedPath(tempDir.resolve("formatted.jsonl"))
                .build();
        ProgressLogListener progress = new ProgressLogListener();
        bus.subscribe(progress);

        GenerationReport report = orchestrator(pool(
                backend("a", ScriptedLLMClient.healthy("a", calls), BackendTag.LOGIC_STRONG),
                backend("b", ScriptedLLMClient.healthy("b", calls), BackendTag.DIVERSITY))).run(config);

        assertEquals(RunStatus.COMPLETED, report.getStatus());
        assertFalse(report.isFatal());
        assertEquals(10, report.getPersisted());
        assertEquals(0, report.getShortfallTotal());
        assertEquals(report.getQuotas().entrySet().stream()
                        .filter(e -> e.getValue() > 0)
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().longValue())),
                report.getPersistedByKind());

        List<String> records = Files.readAllLines(config.getRecordsPath());
        List<String> formatted = Files.readAllLines(config.getFormattedPath());
        assertEquals(10, records.size());
        assertEquals(10, formatted.size());
        assertEquals(10, new HashSet<>(records).size());
        assertTrue(formatted.get(0).contains("<|start_header_id|>system<|end_header_id|>"));

        assertEquals(EventType.RUN_STARTED, events.get(0));
        assertEquals(EventType.RUN_COMPLETED, events.get(events.size() - 1));
        assertEquals(10, events.stream().filter(t -> t == EventType.EXAMPLE_PERSISTED).count());
        assertEquals(10, progress.persistedCount());
    }

    @Test
    void testZeroTargetCompletesWithEmptyOutput() throws IOException {
        PipelineConfig config = baseConfig(0).variantWeight(ToolKind.SANDBOX_EXEC, 1.0).build();

        GenerationReport report = orchestrator(pool(
                backend("a", ScriptedLLMClient.healthy("a", calls)))).run(config);

        assertEquals(RunStatus.COMPLETED, report.getStatus());
        assertEquals(0, report.getAttempts());
        assertTrue(Files.exists(config.getRecordsPath()));
        assertEquals(0, Files.readAllLines(config.getRecordsPath()).size());
        assertTrue(calls.isEmpty());
    }

    // =========================================================================
    // Retry and failover
    // =========================================================================

    @Test
    void testFailedAttemptsMoveToTheNextBackend() {
        PipelineConfig config = baseConfig(1).variantWeight(ToolKind.SANDBOX_EXEC, 1.0).build();

        GenerationReport report = orchestrator(pool(
                backend("a", ScriptedLLMClient.failing("a", calls, BackendErrorKind.UNAVAILABLE)),
                backend("b", ScriptedLLMClient.failing("b", calls, BackendErrorKind.TIMEOUT)),
                backend("c", ScriptedLLMClient.healthy("c", calls)))).run(config);

        assertEquals(RunStatus.COMPLETED, report.getStatus());
        assertEquals(List.of("a", "b", "c"), calls);
        assertEquals(3, report.getAttempts());
        assertEquals(Map.of("TIMEOUT", 1L, "UNAVAILABLE", 1L), report.getBackendErrorsByKind());
        assertTrue(report.getExhaustedByLastCause().isEmpty());
    }

    @Test
    void testRejectedRecordIsRetriedWithinBudget() {
        PipelineConfig config = baseConfig(1).variantWeight(ToolKind.SANDBOX_EXEC, 1.0).build();
        ScriptedLLMClient flaky = ScriptedLLMClient.healthy("a", calls)
                .then("Sure! Here is your record.")
                .then("{\"query\": \"run it\", \"toolCall\": {\"tool_name\": \"sandbox_exec\", \"arguments\": {}}}");

        GenerationReport report = orchestrator(pool(backend("a", flaky))).run(config);

        assertEquals(RunStatus.COMPLETED, report.getStatus());
        assertEquals(3, report.getAttempts());
        assertEquals(Map.of("SCHEMA_MISMATCH", 2L), report.getRejectionsByReason());
        assertEquals(2, events.stream().filter(t -> t == EventType.ATTEMPT_REJECTED).count());
    }

    // =========================================================================
    // Stop conditions
    // =========================================================================

    @Test
    void testAttemptCeilingStopsRunAndReportsShortfall() throws IOException {
        PipelineConfig config = baseConfig(2)
                .variantWeight(ToolKind.SANDBOX_EXEC, 1.0)
                .globalAttemptCeiling(7)
                .build();

        GenerationReport report = orchestrator(pool(
                backend("a", ScriptedLLMClient.constant("a", calls, "this is not json")))).run(config);

        assertEquals(RunStatus.ATTEMPT_CEILING_REACHED, report.getStatus());
        assertFalse(report.isFatal());
        assertEquals(7, report.getAttempts());
        assertEquals(7, calls.size());
        assertEquals(0, report.getPersisted());
        assertEquals(Map.of("sandbox_exec", 2), report.getShortfall());
        assertEquals(Map.of("SCHEMA_MISMATCH", 7L), report.getRejectionsByReason());
        assertEquals(Map.of("SCHEMA_MISMATCH", 2L), report.getExhaustedByLastCause());
        assertEquals(2, events.stream().filter(t -> t == EventType.TASK_EXHAUSTED).count());
        assertEquals(0, Files.readAllLines(config.getRecordsPath()).size());
    }

    @Test
    void testDisabledBackendsEndRunAsFatal() {
        PipelineConfig config = baseConfig(3)
                .variantWeight(ToolKind.SANDBOX_EXEC, 1.0)
                .poolSettings(settings(1, PoolSettings.Strategy.ROUND_ROBIN))
                .build();

        GenerationReport report = orchestrator(pool(config.getPoolSettings(),
                backend("a", ScriptedLLMClient.failing("a", calls, BackendErrorKind.AUTH_FAILED)))).run(config);

        assertEquals(RunStatus.BACKENDS_EXHAUSTED, report.getStatus());
        assertTrue(report.isFatal());
        assertEquals(0, report.getPersisted());
        assertEquals(List.of("a"), calls);
        assertTrue(report.getBackends().get(0).isDisabled());
        assertEquals(EventType.RUN_COMPLETED, events.get(events.size() - 1));
    }

    @Test
    void testDuplicateReleasesSlotWithoutPersisting() throws IOException {
        String record = new MockLLMClient("fixed", mapper).generate("- Target Tool: sandbox_exec", 0.7);
        PipelineConfig config = baseConfig(2)
                .variantWeight(ToolKind.SANDBOX_EXEC, 1.0)
                .globalAttemptCeiling(6)
                .build();

        GenerationReport report = orchestrator(pool(
                backend("a", ScriptedLLMClient.constant("a", calls, record)))).run(config);

        assertEquals(RunStatus.ATTEMPT_CEILING_REACHED, report.getStatus());
        assertEquals(1, report.getPersisted());
        assertEquals(5, report.getDuplicates());
        assertTrue(report.getExhaustedByLastCause().isEmpty());
        assertEquals(1, Files.readAllLines(config.getRecordsPath()).size());
    }

    @Test
    void testUnopenableOutputFailsBeforeAnyRequest() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        PipelineConfig config = baseConfig(1)
                .variantWeight(ToolKind.SANDBOX_EXEC, 1.0)
                .recordsPath(blocker.resolve("records.jsonl"))
                .build();
        PipelineOrchestrator orchestrator = orchestrator(pool(backend("a", ScriptedLLMClient.healthy("a", calls))));

        assertThrows(DatasetIOException.class, () -> orchestrator.run(config));
        assertFalse(orchestrator.isRunning());
        assertTrue(calls.isEmpty());
    }

    @Test
    void testSecondRunStartsWithEmptyDeduplicator() throws IOException {
        String record = new MockLLMClient("fixed", mapper).generate("- Target Tool: sandbox_exec", 0.7);
        PipelineConfig config = baseConfig(1).variantWeight(ToolKind.SANDBOX_EXEC, 1.0).build();
        PipelineOrchestrator orchestrator = orchestrator(pool(
                backend("a", ScriptedLLMClient.constant("a", calls, record))));

        GenerationReport first  = orchestrator.run(config);
        GenerationReport second = orchestrator.run(config);

        assertEquals(RunStatus.COMPLETED, first.getStatus());
        assertEquals(RunStatus.COMPLETED, second.getStatus());
        assertNotEquals(first.getRunId(), second.getRunId());
        assertEquals(1, Files.readAllLines(config.getRecordsPath()).size());
    }

    // =========================================================================
    // Wiring
    // =========================================================================

    private PipelineConfig.Builder baseConfig(int target) {
        return PipelineConfig.builder()
                .domains(List.of("payments", "search infrastructure"))
                .personas(List.of("backend engineer", "new hire"))
                .totalTarget(target)
                .attemptBudget(3)
                .workerCount(1)
                .recordsPath(tempDir.resolve("records.jsonl"))
                .poolSettings(settings(3, PoolSettings.Strategy.ROUND_ROBIN));
    }

    private static PoolSettings settings(int authFailureLimit, PoolSettings.Strategy strategy) {
        return new PoolSettings(Duration.ofMillis(10), Duration.ofMillis(100), 3, authFailureLimit,
                Duration.ofSeconds(5), strategy);
    }

    private PipelineOrchestrator orchestrator(BackendPool pool) {
        PipelineConfig generatorConfig = baseConfig(1).variantWeight(ToolKind.SANDBOX_EXEC, 1.0).build();
        return new PipelineOrchestrator(
                pool,
                new Generator(new PromptBuilder(registry, policy), generatorConfig),
                new Validator(registry, policy, mapper),
                new Deduplicator(stripper),
                new Llama3ChatTemplateRenderer(codec, stripper, mapper),
                codec,
                mapper,
                bus);
    }

    /** Round-robin keeps the backend order of each test predictable. */
    private static BackendPool pool(Backend... backends) {
        return pool(settings(3, PoolSettings.Strategy.ROUND_ROBIN), backends);
    }

    private static BackendPool pool(PoolSettings settings, Backend... backends) {
        return new BackendPool(List.of(backends), new RoundRobinStrategy(), settings);
    }

    private static Backend backend(String id, LLMClient client, BackendTag... tags) {
        Set<BackendTag> tagSet = tags.length == 0 ? EnumSet.noneOf(BackendTag.class) : EnumSet.of(tags[0], tags);
        return new Backend(id, client, 1.0, tagSet);
    }
}
