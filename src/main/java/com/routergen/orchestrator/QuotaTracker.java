package com.routergen.orchestrator;

import com.routergen.config.PipelineConfig;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.generator.QueryStyleCatalog;
import com.routergen.core.schema.ToolKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * QuotaTracker - turns the weighted variant distribution into per-kind quotas
 * and hands out one {@link GenerationTask} per open slot.
 *
 * A slot is reserved while its task is in flight, filled on persistence, and
 * re-opened on duplicate or exhaustion. Workers block in {@link #next()} while
 * every open slot is reserved by someone else.
 *
 * Quotas use the largest-remainder method so they sum exactly to the target.
 */
public class QuotaTracker {

    private final Map<ToolKind, Integer> quotas;
    private final Map<ToolKind, Integer> filled   = new EnumMap<>(ToolKind.class);
    private final Map<ToolKind, Integer> reserved = new EnumMap<>(ToolKind.class);
    private final Map<String, Integer>   domainLoad  = new LinkedHashMap<>();
    private final Map<String, Integer>   personaLoad = new LinkedHashMap<>();
    private final Random                 random;

    private long    nextTaskId = 1;
    private boolean closed;

    public QuotaTracker(PipelineConfig config, Random random) {
        this.quotas = allocate(config.getVariantWeights(), config.getTotalTarget());
        this.random = random;
        for (ToolKind kind : quotas.keySet()) {
            filled.put(kind, 0);
            reserved.put(kind, 0);
        }
        config.getDomains().forEach(d -> domainLoad.put(d, 0));
        config.getPersonas().forEach(p -> personaLoad.put(p, 0));
    }

    // =========================================================================
    // Allocation
    // =========================================================================

    static Map<ToolKind, Integer> allocate(Map<ToolKind, Double> weights, int total) {
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<ToolKind, Integer> result = new EnumMap<>(ToolKind.class);
        Map<ToolKind, Double> remainders = new EnumMap<>(ToolKind.class);

        int assigned = 0;
        for (Map.Entry<ToolKind, Double> e : weights.entrySet()) {
            if (e.getValue() <= 0) continue;
            double exact = total * e.getValue() / sum;
            int floor = (int) Math.floor(exact);
            result.put(e.getKey(), floor);
            remainders.put(e.getKey(), exact - floor);
            assigned += floor;
        }

        List<ToolKind> byRemainder = new ArrayList<>(remainders.keySet());
        byRemainder.sort((a, b) -> Double.compare(remainders.get(b), remainders.get(a)));
        for (int i = 0; i < total - assigned; i++) {
            ToolKind kind = byRemainder.get(i % byRemainder.size());
            result.merge(kind, 1, Integer::sum);
        }
        return result;
    }

    // =========================================================================
    // Slot lifecycle
    // =========================================================================

    /**
     * Reserve the next open slot, blocking while all open slots are in flight.
     *
     * @return the task, or null once every quota is filled or the tracker is closed
     */
    public synchronized GenerationTask next() throws InterruptedException {
        while (true) {
            if (closed || isCompleteLocked()) {
                return null;
            }
            ToolKind kind = mostUnderfilled();
            if (kind != null) {
                return reserve(kind);
            }
            wait();
        }
    }

    /** The task's example was persisted. */
    public synchronized void complete(GenerationTask task) {
        ToolKind kind = task.getTargetKind();
        reserved.merge(kind, -1, Integer::sum);
        filled.merge(kind, 1, Integer::sum);
        notifyAll();
    }

    /** The task was discarded; its slot opens again. */
    public synchronized void release(GenerationTask task) {
        ToolKind kind = task.getTargetKind();
        reserved.merge(kind, -1, Integer::sum);
        domainLoad.computeIfPresent(task.getDomain(), (k, v) -> Math.max(0, v - 1));
        personaLoad.computeIfPresent(task.getPersona(), (k, v) -> Math.max(0, v - 1));
        notifyAll();
    }

    /** Stop handing out tasks; wakes every waiting worker. */
    public synchronized void close() {
        closed = true;
        notifyAll();
    }

    private GenerationTask reserve(ToolKind kind) {
        reserved.merge(kind, 1, Integer::sum);
        String domain  = leastLoaded(domainLoad);
        String persona = leastLoaded(personaLoad);
        domainLoad.merge(domain, 1, Integer::sum);
        personaLoad.merge(persona, 1, Integer::sum);
        return new GenerationTask(nextTaskId++, domain, persona, kind, QueryStyleCatalog.pick(random));
    }

    /** Kind with the largest share of its quota still open, or null if none is open. */
    private ToolKind mostUnderfilled() {
        ToolKind best = null;
        double bestShare = 0;
        for (Map.Entry<ToolKind, Integer> e : quotas.entrySet()) {
            int quota = e.getValue();
            int open = quota - filled.get(e.getKey()) - reserved.get(e.getKey());
            if (open <= 0) continue;
            double share = (double) open / quota;
            if (best == null || share > bestShare) {
                best = e.getKey();
                bestShare = share;
            }
        }
        return best;
    }

    private String leastLoaded(Map<String, Integer> load) {
        int min = Collections.min(load.values());
        List<String> candidates = new ArrayList<>();
        load.forEach((name, count) -> {
            if (count == min) candidates.add(name);
        });
        return candidates.get(random.nextInt(candidates.size()));
    }

    private boolean isCompleteLocked() {
        for (Map.Entry<ToolKind, Integer> e : quotas.entrySet()) {
            if (filled.get(e.getKey()) < e.getValue()) return false;
        }
        return true;
    }

    // =========================================================================
    // Introspection
    // =========================================================================

    public synchronized boolean isComplete() {
        return isCompleteLocked();
    }

    public Map<ToolKind, Integer> getQuotas() {
        return Collections.unmodifiableMap(quotas);
    }

    public synchronized Map<ToolKind, Integer> filledSnapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(filled));
    }

    public synchronized Map<ToolKind, Integer> shortfall() {
        Map<ToolKind, Integer> result = new EnumMap<>(ToolKind.class);
        quotas.forEach((kind, quota) -> {
            int missing = quota - filled.get(kind);
            if (missing > 0) result.put(kind, missing);
        });
        return Collections.unmodifiableMap(result);
    }

    public synchronized Map<String, Integer> domainLoadSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(domainLoad));
    }
}
