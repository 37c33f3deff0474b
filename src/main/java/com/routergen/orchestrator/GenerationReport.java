package com.routergen.orchestrator;

import com.routergen.core.backend.BackendStatus;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * End-of-run summary. Returned by the orchestrator and serialized as-is by the
 * HTTP trigger.
 */
public final class GenerationReport {

    private final String              runId;
    private final RunStatus           status;
    private final int                 target;
    private final long                persisted;
    private final Map<String, Integer> quotas;
    private final Map<String, Integer> shortfall;
    private final long                attempts;
    private final int                 attemptCeiling;
    private final long                duplicates;
    private final Map<String, Long>   persistedByKind;
    private final Map<String, Long>   rejectionsByReason;
    private final Map<String, Long>   backendErrorsByKind;
    private final Map<String, Long>   exhaustedByLastCause;
    private final List<BackendStatus> backends;
    private final String              recordsPath;
    private final Duration            elapsed;

    GenerationReport(String runId, RunStatus status, int target, Map<String, Integer> quotas,
                     Map<String, Integer> shortfall, int attemptCeiling, GenerationStatistics stats,
                     List<BackendStatus> backends, String recordsPath, Duration elapsed) {
        this.runId                = runId;
        this.status               = status;
        this.target               = target;
        this.persisted            = stats.getPersistedTotal();
        this.quotas               = Map.copyOf(quotas);
        this.shortfall            = Map.copyOf(shortfall);
        this.attempts             = stats.getAttempts();
        this.attemptCeiling       = attemptCeiling;
        this.duplicates           = stats.getDuplicates();
        this.persistedByKind      = stats.persistedByKind();
        this.rejectionsByReason   = stats.rejectionsByReason();
        this.backendErrorsByKind  = stats.backendErrorsByKind();
        this.exhaustedByLastCause = stats.exhaustedByLastCause();
        this.backends             = List.copyOf(backends);
        this.recordsPath          = recordsPath;
        this.elapsed              = elapsed;
    }

    public String              getRunId()                { return runId; }
    public RunStatus           getStatus()               { return status; }
    public int                 getTarget()               { return target; }
    public long                getPersisted()            { return persisted; }
    public Map<String, Integer> getQuotas()              { return quotas; }
    public Map<String, Integer> getShortfall()           { return shortfall; }
    public long                getAttempts()             { return attempts; }
    public int                 getAttemptCeiling()       { return attemptCeiling; }
    public long                getDuplicates()           { return duplicates; }
    public Map<String, Long>   getPersistedByKind()      { return persistedByKind; }
    public Map<String, Long>   getRejectionsByReason()   { return rejectionsByReason; }
    public Map<String, Long>   getBackendErrorsByKind()  { return backendErrorsByKind; }
    public Map<String, Long>   getExhaustedByLastCause() { return exhaustedByLastCause; }
    public List<BackendStatus> getBackends()             { return backends; }
    public String              getRecordsPath()          { return recordsPath; }
    public long                getElapsedMillis()        { return elapsed.toMillis(); }

    public boolean isFatal() {
        return status.isFatal();
    }

    public int getShortfallTotal() {
        return shortfall.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return "GenerationReport{run=" + runId + ", status=" + status + ", persisted=" + persisted + "/" + target
                + ", attempts=" + attempts + "/" + attemptCeiling + ", duplicates=" + duplicates
                + ", rejections=" + rejectionsByReason + ", backendErrors=" + backendErrorsByKind
                + ", shortfall=" + shortfall + "}";
    }
}
