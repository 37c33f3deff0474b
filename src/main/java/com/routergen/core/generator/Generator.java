package com.routergen.core.generator;

import com.routergen.config.PipelineConfig;
import com.routergen.core.backend.Backend;
import com.routergen.core.example.GenerationTask;
import com.routergen.llm.BackendErrorKind;
import com.routergen.llm.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generator - exactly one backend request per call.
 *
 * Never retries and never throws for backend failures: every failure comes
 * back as {@link GenerationResult#failed} with a classified kind. Blank output
 * counts as MALFORMED_RESPONSE.
 */
@Component
public class Generator {

    private static final Logger log = LoggerFactory.getLogger(Generator.class);

    private final PromptBuilder promptBuilder;
    private final double        temperature;

    public Generator(PromptBuilder promptBuilder, PipelineConfig config) {
        this.promptBuilder = promptBuilder;
        this.temperature   = config.getTemperature();
    }

    public GenerationResult generate(GenerationTask task, Backend backend) {
        String prompt = promptBuilder.build(task);

        String raw;
        try {
            raw = backend.getClient().generate(prompt, temperature);
        } catch (BackendException e) {
            log.debug("[Generator] {} on {} failed: {}", task, backend, e.getMessage());
            return GenerationResult.failed(backend, new BackendError(e.getKind(), e.getMessage()));
        } catch (RuntimeException e) {
            // unclassified client bug or transport error
            BackendException classified = BackendException.classify(backend.getId(), e);
            log.warn("[Generator] {} on {} raised {}: {}", task, backend, e.getClass().getSimpleName(), e.getMessage());
            return GenerationResult.failed(backend, new BackendError(classified.getKind(), classified.getMessage()));
        }

        if (raw == null || raw.isBlank()) {
            return GenerationResult.failed(backend,
                    new BackendError(BackendErrorKind.MALFORMED_RESPONSE, "Empty response from " + backend.getId()));
        }

        log.debug("[Generator] {} on {} returned {} chars", task, backend, raw.length());
        return GenerationResult.ok(backend, raw);
    }
}
