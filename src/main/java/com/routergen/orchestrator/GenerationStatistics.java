package com.routergen.orchestrator;

import com.routergen.core.schema.ToolKind;
import com.routergen.core.validator.RejectionReason;
import com.routergen.llm.BackendErrorKind;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe aggregate counters for one run. Individual rejected records are
 * never kept, only their counts.
 */
public class GenerationStatistics {

    private final LongAdder attempts        = new LongAdder();
    private final LongAdder duplicates      = new LongAdder();
    private final LongAdder renderFailures  = new LongAdder();
    private final LongAdder lateDiscards    = new LongAdder();

    private final Map<ToolKind, LongAdder>         persisted     = new ConcurrentHashMap<>();
    private final Map<RejectionReason, LongAdder>  rejections    = new ConcurrentHashMap<>();
    private final Map<BackendErrorKind, LongAdder> backendErrors = new ConcurrentHashMap<>();
    private final Map<String, LongAdder>           exhausted     = new ConcurrentHashMap<>();

    void recordAttempt()                            { attempts.increment(); }
    void recordDuplicate()                          { duplicates.increment(); }
    void recordRenderFailure()                      { renderFailures.increment(); }
    void recordLateDiscard()                        { lateDiscards.increment(); }
    void recordPersisted(ToolKind kind)             { counter(persisted, kind).increment(); }
    void recordRejection(RejectionReason reason)    { counter(rejections, reason).increment(); }
    void recordBackendError(BackendErrorKind kind)  { counter(backendErrors, kind).increment(); }
    void recordExhausted(String lastCause)          { counter(exhausted, lastCause).increment(); }

    private static <K> LongAdder counter(Map<K, LongAdder> map, K key) {
        return map.computeIfAbsent(key, k -> new LongAdder());
    }

    public long getAttempts()       { return attempts.sum(); }
    public long getDuplicates()     { return duplicates.sum(); }
    public long getRenderFailures() { return renderFailures.sum(); }
    public long getLateDiscards()   { return lateDiscards.sum(); }

    public long getPersistedTotal() {
        return persisted.values().stream().mapToLong(LongAdder::sum).sum();
    }

    public Map<String, Long> persistedByKind()      { return snapshot(persisted); }
    public Map<String, Long> rejectionsByReason()   { return snapshot(rejections); }
    public Map<String, Long> backendErrorsByKind()  { return snapshot(backendErrors); }
    public Map<String, Long> exhaustedByLastCause() { return snapshot(exhausted); }

    private static <K> Map<String, Long> snapshot(Map<K, LongAdder> map) {
        Map<String, Long> result = new TreeMap<>();
        map.forEach((k, v) -> result.put(k instanceof ToolKind ? ((ToolKind) k).getTag() : k.toString(), v.sum()));
        return result;
    }
}
