package com.routergen.config;

import com.routergen.core.backend.BackendTag;
import com.routergen.core.schema.ToolKind;
import com.routergen.llm.LLMProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the immutable {@link PipelineConfig} and {@link ValidationPolicy} once
 * from routergen.* properties.
 *
 * Backends are declared as an id list plus per-id blocks:
 *
 *   routergen.backends=groq-70b,gemini-flash
 *   routergen.backend.groq-70b.provider=openai
 *   routergen.backend.groq-70b.model=llama-3.3-70b-versatile
 *   routergen.backend.groq-70b.weight=2.0
 *   routergen.backend.groq-70b.tags=LOGIC_STRONG
 */
@Configuration
public class PipelineConfigFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigFactory.class);

    private static final String BACKEND_PREFIX = "routergen.backend.";

    @Bean
    public ValidationPolicy validationPolicy(
            @Value("${routergen.validation.min-query-length:5}")        int minQueryLength,
            @Value("${routergen.validation.min-reasoning-words:8}")     int minReasoningWords,
            @Value("${routergen.validation.max-reasoning-words:100}")   int maxReasoningWords,
            @Value("${routergen.validation.parroting-threshold:0.8}")   double parrotingThreshold,
            @Value("${routergen.validation.min-search-term-length:2}")  int minSearchTermLength,
            @Value("${routergen.validation.generic-search-terms:code,file,function,class,todo}")
                                                                        List<String> genericSearchTerms,
            @Value("${routergen.validation.require-path-in-query:true}") boolean requirePathInQuery,
            @Value("${routergen.validation.dangerous-code-patterns:rm -rf,os.system,__import__,eval(}")
                                                                        List<String> dangerousCodePatterns,
            @Value("${routergen.validation.dangerous-query-keywords:delete,drop,truncate,format,shutdown,kill}")
                                                                        List<String> dangerousQueryKeywords,
            @Value("${routergen.validation.max-sandbox-timeout:300}")   int maxSandboxTimeout,
            @Value("${routergen.validation.null-sentinels:null,none,n/a,nil,undefined}")
                                                                        List<String> nullSentinels
    ) {
        // the empty string is always a sentinel; a comma list cannot express it reliably
        Set<String> sentinels = new LinkedHashSet<>(lowercased(nullSentinels));
        sentinels.add("");


        ValidationPolicy policy = ValidationPolicy.builder()
                .minQueryLength(minQueryLength)
                .minReasoningWords(minReasoningWords)
                .maxReasoningWords(maxReasoningWords)
                .parrotingThreshold(parrotingThreshold)
                .minSearchTermLength(minSearchTermLength)
                .genericSearchTerms(lowercased(genericSearchTerms))
                .requirePathInQuery(requirePathInQuery)
                .dangerousCodePatterns(dangerousCodePatterns)
                .dangerousQueryKeywords(List.copyOf(lowercased(dangerousQueryKeywords)))
                .maxSandboxTimeout(maxSandboxTimeout)
                .nullSentinels(Set.copyOf(sentinels))
                .build();

        log.info("[Config] Validation policy: reasoning words {}..{}, parroting >= {}, pathInQuery={}, sentinels={}",
                minReasoningWords, maxReasoningWords, parrotingThreshold, requirePathInQuery, sentinels);
        return policy;
    }

    @Bean
    public PipelineConfig pipelineConfig(
            Environment env,
            @Value("${routergen.total-target:100}")               int totalTarget,
            @Value("${routergen.attempt-budget:3}")               int attemptBudget,
            @Value("${routergen.global-attempt-ceiling:0}")       int globalAttemptCeiling,
            @Value("${routergen.workers:4}")                      int workers,
            @Value("${routergen.temperature:0.85}")               double temperature,
            @Value("${routergen.seed:42}")                        long seed,
            @Value("${routergen.output.records:data/raw/router_dataset.jsonl}") String recordsPath,
            @Value("${routergen.output.formatted:}")              String formattedPath,
            @Value("${routergen.progress-log-every:25}")          int progressLogEvery
    ) {
        // indexed (routergen.personas[0]=...) so entries may contain commas
        Binder binder = Binder.get(env);
        List<String> domains  = binder.bind("routergen.domains", Bindable.listOf(String.class)).orElse(List.of());
        List<String> personas = binder.bind("routergen.personas", Bindable.listOf(String.class)).orElse(List.of());

        PipelineConfig.Builder builder = PipelineConfig.builder()
                .domains(trimmed(domains))
                .personas(trimmed(personas))
                .totalTarget(totalTarget)
                .attemptBudget(attemptBudget)
                .globalAttemptCeiling(globalAttemptCeiling)
                .workerCount(workers)
                .temperature(temperature)
                .seed(seed)
                .recordsPath(Path.of(recordsPath))
                .formattedPath(formattedPath.isBlank() ? null : Path.of(formattedPath))
                .progressLogEvery(progressLogEvery)
                .poolSettings(poolSettings(env))
                .backends(backends(env));

        for (ToolKind kind : ToolKind.values()) {
            Double weight = env.getProperty("routergen.weights." + kind.getTag(), Double.class);
            if (weight != null) {
                builder.variantWeight(kind, weight);
            }
        }

        PipelineConfig config = builder.build();
        log.info("[Config] {}", config);
        return config;
    }

    // =========================================================================
    // Pool + backends
    // =========================================================================

    private PoolSettings poolSettings(Environment env) {
        String strategy = env.getProperty("routergen.pool.strategy", "weighted")
                .trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return new PoolSettings(
                Duration.ofMillis(env.getProperty("routergen.pool.rate-limit-cooldown-ms", Long.class, 2_000L)),
                Duration.ofMillis(env.getProperty("routergen.pool.max-cooldown-ms", Long.class, 60_000L)),
                env.getProperty("routergen.pool.demotion-threshold", Integer.class, 3),
                env.getProperty("routergen.pool.auth-failure-limit", Integer.class, 3),
                Duration.ofMillis(env.getProperty("routergen.pool.acquire-timeout-ms", Long.class, 120_000L)),
                PoolSettings.Strategy.valueOf(strategy)
        );
    }

    List<BackendDefinition> backends(Environment env) {
        String ids = env.getProperty("routergen.backends", "");
        List<BackendDefinition> result = new ArrayList<>();

        for (String rawId : ids.split(",")) {
            String id = rawId.trim();
            if (id.isEmpty()) continue;

            String prefix = BACKEND_PREFIX + id + ".";
            String provider = env.getProperty(prefix + "provider");
            if (provider == null) {
                throw new IllegalStateException("Backend '" + id + "' has no " + prefix + "provider");
            }

            result.add(new BackendDefinition(
                    id,
                    LLMProvider.fromKey(provider),
                    env.getProperty(prefix + "model", ""),
                    env.getProperty(prefix + "base-url", ""),
                    env.getProperty(prefix + "api-key", ""),
                    env.getProperty(prefix + "weight", Double.class, 1.0),
                    tags(env.getProperty(prefix + "tags", "")),
                    Duration.ofSeconds(env.getProperty(prefix + "timeout-seconds", Long.class, 30L))
            ));
        }
        return result;
    }

    private static Set<BackendTag> tags(String raw) {
        Set<BackendTag> tags = EnumSet.noneOf(BackendTag.class);
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> BackendTag.valueOf(s.toUpperCase(Locale.ROOT).replace('-', '_')))
                .forEach(tags::add);
        return tags;
    }

    private static List<String> trimmed(List<String> values) {
        return values.stream().map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList());
    }

    private static Set<String> lowercased(List<String> values) {
        return values.stream()
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
