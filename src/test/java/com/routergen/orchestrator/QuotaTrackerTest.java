package com.routergen.orchestrator;

import com.routergen.config.PipelineConfig;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.schema.ToolKind;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class QuotaTrackerTest {

    @Test
    void testAllocationSumsExactlyToTarget() {
        Map<ToolKind, Double> weights = new EnumMap<>(ToolKind.class);
        weights.put(ToolKind.CODEBASE_SEARCH, 0.35);
        weights.put(ToolKind.SANDBOX_EXEC, 0.24);
        weights.put(ToolKind.FILE_MANAGER, 0.18);
        weights.put(ToolKind.ASK_HUMAN, 0.08);

        for (int total : new int[]{0, 1, 7, 85, 100, 1_001}) {
            Map<ToolKind, Integer> quotas = QuotaTracker.allocate(weights, total);
            assertEquals(total, quotas.values().stream().mapToInt(Integer::intValue).sum(), "total " + total);
        }

        Map<ToolKind, Integer> split = QuotaTracker.allocate(weights, 85);
        assertEquals(35, split.get(ToolKind.CODEBASE_SEARCH));
        assertEquals(24, split.get(ToolKind.SANDBOX_EXEC));
        assertEquals(18, split.get(ToolKind.FILE_MANAGER));
        assertEquals(8, split.get(ToolKind.ASK_HUMAN));
    }

    @Test
    void testZeroWeightKindGetsNoQuota() {
        Map<ToolKind, Double> weights = new EnumMap<>(ToolKind.class);
        weights.put(ToolKind.SANDBOX_EXEC, 1.0);
        weights.put(ToolKind.ASK_HUMAN, 0.0);

        Map<ToolKind, Integer> quotas = QuotaTracker.allocate(weights, 10);

        assertEquals(Map.of(ToolKind.SANDBOX_EXEC, 10), quotas);
    }

    @Test
    void testTasksSpreadAcrossDomainsAndPersonas() throws Exception {
        QuotaTracker tracker = new QuotaTracker(config(6, List.of("d1", "d2", "d3"), List.of("p1", "p2")),
                new Random(1));

        Set<String> domains = new HashSet<>();
        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 6; i++) {
            GenerationTask task = tracker.next();
            assertNotNull(task);
            domains.add(task.getDomain());
            ids.add(task.getTaskId());
        }

        assertEquals(Set.of("d1", "d2", "d3"), domains);
        assertEquals(6, ids.size());
        tracker.domainLoadSnapshot().values().forEach(load -> assertEquals(2, load));
    }

    @Test
    void testReleaseReopensSlotAndCompleteFillsIt() throws Exception {
        QuotaTracker tracker = new QuotaTracker(config(2, List.of("d"), List.of("p")), new Random(1));

        GenerationTask first = tracker.next();
        GenerationTask second = tracker.next();
        tracker.release(first);
        GenerationTask retry = tracker.next();
        assertNotNull(retry);
        assertNotEquals(first.getTaskId(), retry.getTaskId());

        tracker.complete(second);
        tracker.complete(retry);

        assertTrue(tracker.isComplete());
        assertNull(tracker.next());
        assertTrue(tracker.shortfall().isEmpty());
        assertEquals(2, tracker.filledSnapshot().get(ToolKind.SANDBOX_EXEC));
    }

    @Test
    void testNextBlocksWhileSlotsAreInFlight() throws Exception {
        QuotaTracker tracker = new QuotaTracker(config(1, List.of("d"), List.of("p")), new Random(1));
        GenerationTask only = tracker.next();

        CompletableFuture<GenerationTask> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return tracker.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        assertThrows(TimeoutException.class, () -> waiter.get(200, TimeUnit.MILLISECONDS));

        tracker.release(only);
        GenerationTask reissued = waiter.get(5, TimeUnit.SECONDS);
        assertNotNull(reissued);
        assertEquals(ToolKind.SANDBOX_EXEC, reissued.getTargetKind());
    }

    @Test
    void testCloseWakesWaitingWorkers() throws Exception {
        QuotaTracker tracker = new QuotaTracker(config(1, List.of("d"), List.of("p")), new Random(1));
        tracker.next();

        CompletableFuture<GenerationTask> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return tracker.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        tracker.close();

        assertNull(waiter.get(5, TimeUnit.SECONDS));
        assertEquals(Map.of(ToolKind.SANDBOX_EXEC, 1), tracker.shortfall());
    }

    private static PipelineConfig config(int target, List<String> domains, List<String> personas) {
        return PipelineConfig.builder()
                .domains(domains)
                .personas(personas)
                .variantWeight(ToolKind.SANDBOX_EXEC, 1.0)
                .totalTarget(target)
                .build();
    }
}
