package com.routergen.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routergen.communication.EventBus;
import com.routergen.config.PipelineConfig;
import com.routergen.core.backend.Backend;
import com.routergen.core.backend.BackendPool;
import com.routergen.core.backend.NoBackendAvailableException;
import com.routergen.core.dataset.DatasetIOException;
import com.routergen.core.dataset.DatasetSink;
import com.routergen.core.dataset.JsonlDatasetSink;
import com.routergen.core.dedup.AdmissionResult;
import com.routergen.core.dedup.Deduplicator;
import com.routergen.core.event.Event;
import com.routergen.core.event.EventType;
import com.routergen.core.example.Example;
import com.routergen.core.example.ExampleCodec;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.format.ChatTemplateRenderer;
import com.routergen.core.generator.GenerationResult;
import com.routergen.core.generator.Generator;
import com.routergen.core.schema.ToolKind;
import com.routergen.core.validator.ValidationOutcome;
import com.routergen.core.validator.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PipelineOrchestrator - drives a generation run to its quota.
 *
 * Per task:  acquire backend → generate → validate → deduplicate → render → persist
 *
 * A task gets at most attemptBudget attempts. Backend failures and validation
 * rejections retry the same task on the next backend the pool hands out; a
 * duplicate or render failure discards the task and re-opens its slot.
 *
 * Workers share the quota tracker, the pool, the deduplicator and the sink.
 * Completion is decided under one persist gate so the run never writes more
 * than totalTarget records, and nothing is written after the run has stopped.
 *
 * Stop conditions:
 *   - every quota filled                  → COMPLETED
 *   - global attempt ceiling reached      → ATTEMPT_CEILING_REACHED
 *   - every backend permanently disabled  → BACKENDS_EXHAUSTED (fatal)
 *   - sink write failed                   → OUTPUT_FAILED (fatal)
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final BackendPool          pool;
    private final Generator            generator;
    private final Validator            validator;
    private final Deduplicator         deduplicator;
    private final ChatTemplateRenderer renderer;
    private final ExampleCodec         codec;
    private final ObjectMapper         objectMapper;
    private final EventBus             eventBus;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public PipelineOrchestrator(
            BackendPool          pool,
            Generator            generator,
            Validator            validator,
            Deduplicator         deduplicator,
            ChatTemplateRenderer renderer,
            ExampleCodec         codec,
            ObjectMapper         objectMapper,
            EventBus             eventBus
    ) {
        this.pool         = pool;
        this.generator    = generator;
        this.validator    = validator;
        this.deduplicator = deduplicator;
        this.renderer     = renderer;
        this.codec        = codec;
        this.objectMapper = objectMapper;
        this.eventBus     = eventBus;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    /**
     * Run one generation to completion or to a stop condition.
     *
     * Output files are truncated at the start of the run. Records persisted
     * before a fatal stop stay on disk.
     *
     * @throws IllegalStateException when another run is already in progress
     * @throws DatasetIOException    when the output files cannot be opened
     */
    public GenerationReport run(PipelineConfig config) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A generation run is already in progress");
        }
        try {
            return execute(config);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private GenerationReport execute(PipelineConfig config) {
        long startNanos = System.nanoTime();
        String runId = UUID.randomUUID().toString().substring(0, 8);

        log.info("========== GENERATION RUN {} START ==========", runId);
        log.info("[Orchestrator] {}", config);

        deduplicator.reset();
        QuotaTracker quotas = new QuotaTracker(config, new Random(config.getSeed()));
        log.info("[Orchestrator] Quotas: {}", tagged(quotas.getQuotas()));

        try (DatasetSink sink = JsonlDatasetSink.open(
                config.getRecordsPath(), config.getFormattedPath(), codec, objectMapper)) {

            Run run = new Run(runId, config, quotas, sink);
            eventBus.publish(Event.forRun(EventType.RUN_STARTED, runId, config));

            if (config.getTotalTarget() > 0) {
                runWorkers(run);
            }

            RunStatus status = run.finalStatus();
            GenerationReport report = new GenerationReport(
                    runId,
                    status,
                    config.getTotalTarget(),
                    tagged(quotas.getQuotas()),
                    tagged(quotas.shortfall()),
                    config.getGlobalAttemptCeiling(),
                    run.stats,
                    pool.snapshot(),
                    config.getRecordsPath().toString(),
                    Duration.ofNanos(System.nanoTime() - startNanos));

            logSummary(report);
            eventBus.publish(Event.forRun(EventType.RUN_COMPLETED, runId, report));
            return report;
        }
    }

    // =========================================================================
    // WORKERS
    // =========================================================================

    private void runWorkers(Run run) {
        int workers = run.config.getWorkerCount();
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreads(run.runId));

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            futures.add(executor.submit(() -> workerLoop(run)));
        }
        executor.shutdown();

        try {
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.stop(RunStatus.INTERRUPTED, "orchestrator thread interrupted");
            executor.shutdownNow();
        } catch (ExecutionException e) {
            // workerLoop catches everything it expects; anything else is a bug
            log.error("[Orchestrator] Worker crashed", e.getCause());
            run.stop(RunStatus.INTERRUPTED, "worker crashed: " + e.getCause());
            executor.shutdownNow();
        }

        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[Orchestrator] Workers still running {}s after stop", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "routergen-" + runId + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void workerLoop(Run run) {
        while (!run.isStopped()) {
            GenerationTask task;
            try {
                task = run.quotas.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.stop(RunStatus.INTERRUPTED, "worker interrupted");
                return;
            }
            if (task == null) {
                return;
            }
            processTask(run, task);
        }
    }

    // =========================================================================
    // PER-TASK ATTEMPT LOOP
    // =========================================================================

    private void processTask(Run run, GenerationTask task) {
        int budget = run.config.getAttemptBudget();
        Backend previous = null;
        String lastCause = "none";

        for (int attempt = 1; attempt <= budget; attempt++) {

            if (run.isStopped()) {
                run.quotas.release(task);
                return;
            }
            if (!run.claimAttempt()) {
                run.stop(RunStatus.ATTEMPT_CEILING_REACHED,
                        "global attempt ceiling " + run.config.getGlobalAttemptCeiling() + " reached");
                run.quotas.release(task);
                return;
            }
            run.stats.recordAttempt();
            trace(task, attempt, AttemptStage.REQUESTED, previous);

            // ── acquire ───────────────────────────────────────────────────
            Backend backend;
            try {
                backend = pool.acquire(task, previous);
            } catch (NoBackendAvailableException e) {
                if (e.isFatal()) {
                    run.stop(RunStatus.BACKENDS_EXHAUSTED, e.getMessage());
                    run.quotas.release(task);
                    return;
                }
                log.warn("[Orchestrator] {} attempt {}/{}: {}", task, attempt, budget, e.getMessage());
                lastCause = "NO_BACKEND";
                continue;
            }

            // ── generate ──────────────────────────────────────────────────
            GenerationResult result = generator.generate(task, backend);
            if (!result.isSuccess()) {
                pool.reportFailure(backend, result.getError().getKind());
                run.stats.recordBackendError(result.getError().getKind());
                run.publish(EventType.BACKEND_FAILED, task, result.getError());
                trace(task, attempt, AttemptStage.BACKEND_FAILED, backend);
                lastCause = result.getError().getKind().name();
                previous = backend;
                continue;
            }
            pool.reportSuccess(backend);
            trace(task, attempt, AttemptStage.GENERATED, backend);

            // ── validate ──────────────────────────────────────────────────
            ValidationOutcome outcome = validator.validate(result.getRawText(), task);
            if (!outcome.isAccepted()) {
                run.stats.recordRejection(outcome.getReason());
                run.publish(EventType.ATTEMPT_REJECTED, task, outcome);
                trace(task, attempt, AttemptStage.REJECTED, backend);
                log.debug("[Orchestrator] {} attempt {}/{} rejected by {}: {} {}",
                        task, attempt, budget, backend, outcome.getReason(), outcome.getDetails());
                lastCause = outcome.getReason().name();
                previous = backend;
                continue;
            }
            trace(task, attempt, AttemptStage.VALIDATED, backend);

            // ── deduplicate ───────────────────────────────────────────────
            AdmissionResult admission = deduplicator.admit(outcome.getExample());
            if (!admission.isAdmitted()) {
                run.stats.recordDuplicate();
                trace(task, attempt, AttemptStage.REJECTED_DUPLICATE, backend);
                log.debug("[Orchestrator] {} duplicate {}; slot re-opened", task, admission.getFingerprint());
                run.quotas.release(task);
                return;
            }
            trace(task, attempt, AttemptStage.DEDUPLICATED, backend);
            Example example = admission.getExample();

            // ── render ────────────────────────────────────────────────────
            String rendered;
            try {
                rendered = renderer.render(example);
            } catch (IllegalStateException e) {
                run.stats.recordRenderFailure();
                log.warn("[Orchestrator] {} could not be rendered: {}", task, e.getMessage());
                run.quotas.release(task);
                return;
            }
            trace(task, attempt, AttemptStage.FORMATTED, backend);

            // ── persist ───────────────────────────────────────────────────
            if (!run.persist(task, example, rendered)) {
                trace(task, attempt, AttemptStage.DISCARDED, backend);
                return;
            }
            run.stats.recordPersisted(task.getTargetKind());
            trace(task, attempt, AttemptStage.PERSISTED, backend);
            run.publish(EventType.EXAMPLE_PERSISTED, task, example);
            return;
        }

        run.stats.recordExhausted(lastCause);
        run.quotas.release(task);
        run.publish(EventType.TASK_EXHAUSTED, task, lastCause);
        log.warn("[Orchestrator] {} exhausted {} attempt(s); last cause {}", task, budget, lastCause);
    }

    private static void trace(GenerationTask task, int attempt, AttemptStage stage, Backend backend) {
        if (log.isDebugEnabled()) {
            log.debug("[Orchestrator] task={} attempt={} stage={} backend={}",
                    task.getTaskId(), attempt, stage, backend == null ? "-" : backend.getId());
        }
    }

    // =========================================================================
    // SUMMARY
    // =========================================================================

    private void logSummary(GenerationReport report) {
        String banner = report.getStatus() == RunStatus.COMPLETED ? "SUCCESS" : report.getStatus().name();
        log.info("========== GENERATION RUN {} {} ==========", report.getRunId(), banner);
        log.info("[Orchestrator] Persisted  : {}/{} {}", report.getPersisted(), report.getTarget(),
                report.getPersistedByKind());
        log.info("[Orchestrator] Attempts   : {} (ceiling {})", report.getAttempts(), report.getAttemptCeiling());
        log.info("[Orchestrator] Rejections : {}", report.getRejectionsByReason());
        log.info("[Orchestrator] Backend err: {}", report.getBackendErrorsByKind());
        log.info("[Orchestrator] Duplicates : {}", report.getDuplicates());
        log.info("[Orchestrator] Exhausted  : {}", report.getExhaustedByLastCause());
        log.info("[Orchestrator] Backends   : {}", report.getBackends());
        log.info("[Orchestrator] Elapsed    : {} ms", report.getElapsedMillis());
        if (report.getShortfallTotal() > 0) {
            log.warn("[Orchestrator] Shortfall  : {}", report.getShortfall());
        }
    }

    private static Map<String, Integer> tagged(Map<ToolKind, Integer> byKind) {
        Map<String, Integer> result = new LinkedHashMap<>();
        byKind.forEach((kind, count) -> result.put(kind.getTag(), count));
        return result;
    }

    // =========================================================================
    // RUN STATE
    // =========================================================================

    /** Mutable state of one run, shared by its workers. */
    private final class Run {

        final String               runId;
        final PipelineConfig       config;
        final QuotaTracker         quotas;
        final DatasetSink          sink;
        final GenerationStatistics stats = new GenerationStatistics();

        private final AtomicInteger              attempts   = new AtomicInteger();
        private final AtomicReference<RunStatus> stopStatus = new AtomicReference<>();
        private final Object                     persistGate = new Object();

        Run(String runId, PipelineConfig config, QuotaTracker quotas, DatasetSink sink) {
            this.runId  = runId;
            this.config = config;
            this.quotas = quotas;
            this.sink   = sink;
        }

        boolean claimAttempt() {
            return attempts.incrementAndGet() <= config.getGlobalAttemptCeiling();
        }

        boolean isStopped() {
            return stopStatus.get() != null;
        }

        void stop(RunStatus status, String reason) {
            synchronized (persistGate) {
                if (stopStatus.compareAndSet(null, status)) {
                    if (status.isFatal()) {
                        log.error("[Orchestrator] Run {} stopping: {} ({})", runId, status, reason);
                    } else {
                        log.warn("[Orchestrator] Run {} stopping: {} ({})", runId, status, reason);
                    }
                }
            }
            quotas.close();
        }

        /**
         * Write and mark the slot filled, atomically with respect to stop().
         *
         * @return false when the run had already stopped and the example was discarded
         */
        boolean persist(GenerationTask task, Example example, String rendered) {
            synchronized (persistGate) {
                if (isStopped()) {
                    stats.recordLateDiscard();
                    quotas.release(task);
                    return false;
                }
                try {
                    sink.write(example, rendered);
                } catch (DatasetIOException e) {
                    quotas.release(task);
                    stopStatus.compareAndSet(null, RunStatus.OUTPUT_FAILED);
                    log.error("[Orchestrator] Run {} stopping: OUTPUT_FAILED ({})", runId, e.getMessage(), e);
                    quotas.close();
                    return false;
                }
                quotas.complete(task);
                return true;
            }
        }

        RunStatus finalStatus() {
            RunStatus stopped = stopStatus.get();
            if (stopped != null) {
                return stopped;
            }
            return quotas.isComplete() ? RunStatus.COMPLETED : RunStatus.INTERRUPTED;
        }

        void publish(EventType type, GenerationTask task, Object payload) {
            eventBus.publish(Event.forTask(type, runId, task.getTaskId(), payload));
        }
    }
}
