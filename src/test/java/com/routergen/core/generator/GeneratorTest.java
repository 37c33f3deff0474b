package com.routergen.core.generator;

import com.routergen.config.PipelineConfig;
import com.routergen.config.ValidationPolicy;
import com.routergen.core.backend.Backend;
import com.routergen.core.backend.BackendTag;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.ToolKind;
import com.routergen.llm.BackendErrorKind;
import com.routergen.llm.BackendException;
import com.routergen.llm.LLMClient;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorTest {

    private final ValidationPolicy policy = ValidationPolicy.defaults();
    private final GenerationTask   task   =
            new GenerationTask(1, "payments", "backend engineer", ToolKind.SANDBOX_EXEC, "direct");

    @Test
    void testSuccessfulCallReturnsRawText() {
        AtomicReference<Double> seenTemperature = new AtomicReference<>();
        Backend backend = backend((prompt, temperature) -> {
            seenTemperature.set(temperature);
            return "{\"query\": \"...\"}";
        });

        GenerationResult result = generator(0.4).generate(task, backend);

        assertTrue(result.isSuccess());
        assertEquals("{\"query\": \"...\"}", result.getRawText());
        assertSame(backend, result.getBackend());
        assertEquals(0.4, seenTemperature.get());
    }

    @Test
    void testBackendExceptionBecomesFailedResult() {
        Backend backend = backend((prompt, temperature) -> {
            throw new BackendException(BackendErrorKind.RATE_LIMITED, "slow down");
        });

        GenerationResult result = generator(0.7).generate(task, backend);

        assertFalse(result.isSuccess());
        assertEquals(BackendErrorKind.RATE_LIMITED, result.getError().getKind());
    }

    @Test
    void testUnclassifiedExceptionIsClassified() {
        Backend backend = backend((prompt, temperature) -> {
            throw new HttpClientErrorException(HttpStatus.UNAUTHORIZED);
        });

        GenerationResult result = generator(0.7).generate(task, backend);

        assertEquals(BackendErrorKind.AUTH_FAILED, result.getError().getKind());
    }

    @Test
    void testBlankOutputIsMalformed() {
        GenerationResult blank = generator(0.7).generate(task, backend((p, t) -> "  \n"));
        GenerationResult nul   = generator(0.7).generate(task, backend((p, t) -> null));

        assertEquals(BackendErrorKind.MALFORMED_RESPONSE, blank.getError().getKind());
        assertEquals(BackendErrorKind.MALFORMED_RESPONSE, nul.getError().getKind());
    }

    private Generator generator(double temperature) {
        PipelineConfig config = PipelineConfig.builder()
                .domains(List.of("payments"))
                .personas(List.of("backend engineer"))
                .variantWeight(ToolKind.SANDBOX_EXEC, 1.0)
                .temperature(temperature)
                .recordsPath(Path.of("unused.jsonl"))
                .build();
        return new Generator(new PromptBuilder(new SchemaRegistry(policy), policy), config);
    }

    private static Backend backend(Reply reply) {
        LLMClient client = new LLMClient() {
            @Override
            public String generate(String prompt, double temperature) {
                return reply.answer(prompt, temperature);
            }

            @Override
            public String getModel() {
                return "fake";
            }
        };
        return new Backend("fake", client, 1.0, EnumSet.noneOf(BackendTag.class));
    }

    @FunctionalInterface
    private interface Reply {
        String answer(String prompt, double temperature);
    }
}
