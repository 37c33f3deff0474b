package com.routergen.config;

import com.routergen.core.schema.ToolKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * PipelineConfig - immutable run configuration, passed explicitly to the
 * orchestrator. No component reads routergen.* properties on its own.
 *
 * globalAttemptCeiling of 0 means "derive": totalTarget * attemptBudget * 2.
 */
public final class PipelineConfig {

    private final List<String>             domains;
    private final List<String>             personas;
    private final Map<ToolKind, Double>    variantWeights;
    private final int                      totalTarget;
    private final int                      attemptBudget;
    private final int                      globalAttemptCeiling;
    private final int                      workerCount;
    private final double                   temperature;
    private final long                     seed;
    private final Path                     recordsPath;
    private final Path                     formattedPath;
    private final int                      progressLogEvery;
    private final PoolSettings             poolSettings;
    private final List<BackendDefinition>  backends;

    private PipelineConfig(Builder b) {
        this.domains              = List.copyOf(b.domains);
        this.personas             = List.copyOf(b.personas);
        this.variantWeights       = Collections.unmodifiableMap(new EnumMap<>(b.variantWeights));
        this.totalTarget          = b.totalTarget;
        this.attemptBudget        = b.attemptBudget;
        this.globalAttemptCeiling = b.globalAttemptCeiling > 0
                ? b.globalAttemptCeiling
                : b.totalTarget * b.attemptBudget * 2;
        this.workerCount          = b.workerCount;
        this.temperature          = b.temperature;
        this.seed                 = b.seed;
        this.recordsPath          = b.recordsPath;
        this.formattedPath        = b.formattedPath;
        this.progressLogEvery     = b.progressLogEvery;
        this.poolSettings         = b.poolSettings;
        this.backends             = List.copyOf(b.backends);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String>            getDomains()              { return domains; }
    public List<String>            getPersonas()             { return personas; }
    public Map<ToolKind, Double>   getVariantWeights()       { return variantWeights; }
    public int                     getTotalTarget()          { return totalTarget; }
    public int                     getAttemptBudget()        { return attemptBudget; }
    public int                     getGlobalAttemptCeiling() { return globalAttemptCeiling; }
    public int                     getWorkerCount()          { return workerCount; }
    public double                  getTemperature()          { return temperature; }
    public long                    getSeed()                 { return seed; }
    public Path                    getRecordsPath()          { return recordsPath; }
    public Path                    getFormattedPath()        { return formattedPath; }
    public int                     getProgressLogEvery()     { return progressLogEvery; }
    public PoolSettings            getPoolSettings()         { return poolSettings; }
    public List<BackendDefinition> getBackends()             { return backends; }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.domains              = new ArrayList<>(domains);
        b.personas             = new ArrayList<>(personas);
        b.variantWeights       = new EnumMap<>(variantWeights);
        b.totalTarget          = totalTarget;
        b.attemptBudget        = attemptBudget;
        b.globalAttemptCeiling = 0;
        b.workerCount          = workerCount;
        b.temperature          = temperature;
        b.seed                 = seed;
        b.recordsPath          = recordsPath;
        b.formattedPath        = formattedPath;
        b.progressLogEvery     = progressLogEvery;
        b.poolSettings         = poolSettings;
        b.backends             = new ArrayList<>(backends);
        return b;
    }

    @Override
    public String toString() {
        return "PipelineConfig{target=" + totalTarget
                + ", weights=" + variantWeights
                + ", domains=" + domains.size()
                + ", personas=" + personas.size()
                + ", attemptBudget=" + attemptBudget
                + ", ceiling=" + globalAttemptCeiling
                + ", workers=" + workerCount
                + ", backends=" + backends
                + "}";
    }

    public static final class Builder {

        private List<String>             domains              = new ArrayList<>();
        private List<String>             personas             = new ArrayList<>();
        private Map<ToolKind, Double>    variantWeights       = new EnumMap<>(ToolKind.class);
        private int                      totalTarget          = 100;
        private int                      attemptBudget        = 3;
        private int                      globalAttemptCeiling = 0;
        private int                      workerCount          = 4;
        private double                   temperature          = 0.85;
        private long                     seed                 = 42L;
        private Path                     recordsPath          = Path.of("data", "raw", "router_dataset.jsonl");
        private Path                     formattedPath        = null;
        private int                      progressLogEvery     = 25;
        private PoolSettings             poolSettings         = PoolSettings.defaults();
        private List<BackendDefinition>  backends             = new ArrayList<>();

        private Builder() {
        }

        public Builder domains(List<String> v)                  { this.domains = new ArrayList<>(v); return this; }
        public Builder personas(List<String> v)                 { this.personas = new ArrayList<>(v); return this; }
        public Builder variantWeight(ToolKind kind, double w)   { this.variantWeights.put(kind, w); return this; }
        public Builder variantWeights(Map<ToolKind, Double> v)  { this.variantWeights = new EnumMap<>(v); return this; }
        public Builder totalTarget(int v)                       { this.totalTarget = v; return this; }
        public Builder attemptBudget(int v)                     { this.attemptBudget = v; return this; }
        public Builder globalAttemptCeiling(int v)              { this.globalAttemptCeiling = v; return this; }
        public Builder workerCount(int v)                       { this.workerCount = v; return this; }
        public Builder temperature(double v)                    { this.temperature = v; return this; }
        public Builder seed(long v)                             { this.seed = v; return this; }
        public Builder recordsPath(Path v)                      { this.recordsPath = v; return this; }
        public Builder formattedPath(Path v)                    { this.formattedPath = v; return this; }
        public Builder progressLogEvery(int v)                  { this.progressLogEvery = v; return this; }
        public Builder poolSettings(PoolSettings v)             { this.poolSettings = v; return this; }
        public Builder backends(List<BackendDefinition> v)      { this.backends = new ArrayList<>(v); return this; }

        public PipelineConfig build() {
            if (domains.isEmpty())  throw new IllegalArgumentException("At least one domain is required");
            if (personas.isEmpty()) throw new IllegalArgumentException("At least one persona is required");
            if (totalTarget < 0)    throw new IllegalArgumentException("totalTarget must be >= 0");
            if (attemptBudget < 1)  throw new IllegalArgumentException("attemptBudget must be >= 1");
            if (workerCount < 1)    throw new IllegalArgumentException("workerCount must be >= 1");
            if (recordsPath == null) throw new IllegalArgumentException("recordsPath is required");

            double weightSum = 0;
            for (Map.Entry<ToolKind, Double> e : variantWeights.entrySet()) {
                if (e.getValue() < 0) {
                    throw new IllegalArgumentException("Negative weight for " + e.getKey());
                }
                weightSum += e.getValue();
            }
            if (weightSum <= 0) {
                throw new IllegalArgumentException("Variant weights must sum to a positive value");
            }
            return new PipelineConfig(this);
        }
    }
}
