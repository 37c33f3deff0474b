package com.routergen.config;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * ValidationPolicy - immutable thresholds and word lists used by the Validator,
 * the domain rules and the null-field stripper.
 *
 * Built once by {@link PipelineConfigFactory} from routergen.validation.* properties.
 * {@link #defaults()} mirrors the values shipped in application.properties and is
 * what unit tests use.
 */
public final class ValidationPolicy {

    private final int          minQueryLength;
    private final int          minReasoningWords;
    private final int          maxReasoningWords;
    private final double       parrotingThreshold;
    private final int          minSearchTermLength;
    private final Set<String>  genericSearchTerms;
    private final boolean      requirePathInQuery;
    private final List<String> dangerousCodePatterns;
    private final List<String> dangerousQueryKeywords;
    private final int          maxSandboxTimeout;
    private final Set<String>  nullSentinels;

    private ValidationPolicy(Builder b) {
        this.minQueryLength         = b.minQueryLength;
        this.minReasoningWords      = b.minReasoningWords;
        this.maxReasoningWords      = b.maxReasoningWords;
        this.parrotingThreshold     = b.parrotingThreshold;
        this.minSearchTermLength    = b.minSearchTermLength;
        this.genericSearchTerms     = Set.copyOf(b.genericSearchTerms);
        this.requirePathInQuery     = b.requirePathInQuery;
        this.dangerousCodePatterns  = List.copyOf(b.dangerousCodePatterns);
        this.dangerousQueryKeywords = List.copyOf(b.dangerousQueryKeywords);
        this.maxSandboxTimeout      = b.maxSandboxTimeout;
        this.nullSentinels          = Set.copyOf(b.nullSentinels);
    }

    public static ValidationPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int          getMinQueryLength()         { return minQueryLength; }
    public int          getMinReasoningWords()      { return minReasoningWords; }
    public int          getMaxReasoningWords()      { return maxReasoningWords; }
    public double       getParrotingThreshold()     { return parrotingThreshold; }
    public int          getMinSearchTermLength()    { return minSearchTermLength; }
    public Set<String>  getGenericSearchTerms()     { return genericSearchTerms; }
    public boolean      isRequirePathInQuery()      { return requirePathInQuery; }
    public List<String> getDangerousCodePatterns()  { return dangerousCodePatterns; }
    public List<String> getDangerousQueryKeywords() { return dangerousQueryKeywords; }
    public int          getMaxSandboxTimeout()      { return maxSandboxTimeout; }
    public Set<String>  getNullSentinels()          { return nullSentinels; }

    /**
     * True when the value is one of the configured null sentinels
     * ("", "null", "none", ...), compared trimmed and case-insensitively.
     */
    public boolean isNullSentinel(String value) {
        if (value == null) return true;
        return nullSentinels.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    public Builder toBuilder() {
        return new Builder()
                .minQueryLength(minQueryLength)
                .minReasoningWords(minReasoningWords)
                .maxReasoningWords(maxReasoningWords)
                .parrotingThreshold(parrotingThreshold)
                .minSearchTermLength(minSearchTermLength)
                .genericSearchTerms(genericSearchTerms)
                .requirePathInQuery(requirePathInQuery)
                .dangerousCodePatterns(dangerousCodePatterns)
                .dangerousQueryKeywords(dangerousQueryKeywords)
                .maxSandboxTimeout(maxSandboxTimeout)
                .nullSentinels(nullSentinels);
    }

    public static final class Builder {

        private int          minQueryLength         = 5;
        private int          minReasoningWords      = 8;
        private int          maxReasoningWords      = 100;
        private double       parrotingThreshold     = 0.8;
        private int          minSearchTermLength    = 2;
        private Set<String>  genericSearchTerms     = Set.of("code", "file", "function", "class", "todo");
        private boolean      requirePathInQuery     = true;
        private List<String> dangerousCodePatterns  = List.of("rm -rf", "os.system", "__import__", "eval(");
        private List<String> dangerousQueryKeywords = List.of("delete", "drop", "truncate", "format", "shutdown", "kill");
        private int          maxSandboxTimeout      = 300;
        private Set<String>  nullSentinels          = Set.of("", "null", "none", "n/a", "nil", "undefined");

        private Builder() {
        }

        public Builder minQueryLength(int v)                 { this.minQueryLength = v; return this; }
        public Builder minReasoningWords(int v)              { this.minReasoningWords = v; return this; }
        public Builder maxReasoningWords(int v)              { this.maxReasoningWords = v; return this; }
        public Builder parrotingThreshold(double v)          { this.parrotingThreshold = v; return this; }
        public Builder minSearchTermLength(int v)            { this.minSearchTermLength = v; return this; }
        public Builder genericSearchTerms(Set<String> v)     { this.genericSearchTerms = v; return this; }
        public Builder requirePathInQuery(boolean v)         { this.requirePathInQuery = v; return this; }
        public Builder dangerousCodePatterns(List<String> v) { this.dangerousCodePatterns = v; return this; }
        public Builder dangerousQueryKeywords(List<String> v){ this.dangerousQueryKeywords = v; return this; }
        public Builder maxSandboxTimeout(int v)              { this.maxSandboxTimeout = v; return this; }
        public Builder nullSentinels(Set<String> v)          { this.nullSentinels = v; return this; }

        public ValidationPolicy build() {
            if (minReasoningWords > maxReasoningWords) {
                throw new IllegalArgumentException(
                        "minReasoningWords (" + minReasoningWords + ") exceeds maxReasoningWords (" + maxReasoningWords + ")");
            }
            return new ValidationPolicy(this);
        }
    }
}
