package com.routergen.core.generator;

import com.routergen.config.ValidationPolicy;
import com.routergen.core.example.GenerationTask;
import com.routergen.core.schema.SchemaRegistry;
import com.routergen.core.schema.ToolKind;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private final ValidationPolicy policy   = ValidationPolicy.defaults();
    private final SchemaRegistry   registry = new SchemaRegistry(policy);
    private final PromptBuilder    builder  = new PromptBuilder(registry, policy);

    @Test
    void testPromptCarriesTaskContextAndTargetLine() {
        GenerationTask task = new GenerationTask(7, "payments", "new hire", ToolKind.FILE_MANAGER, "urgent");

        String prompt = builder.build(task);

        assertTrue(prompt.contains("- Domain: payments\n"));
        assertTrue(prompt.contains("- Persona: new hire\n"));
        assertTrue(prompt.contains("- Target Tool: file_manager\n"));
        assertTrue(prompt.contains("'urgent' style"));
        assertTrue(prompt.contains("between 8 and 100 words"));
    }

    @Test
    void testSchemaSectionMatchesRegistry() {
        for (ToolKind kind : ToolKind.values()) {
            GenerationTask task = new GenerationTask(1, "d", "p", kind, "direct");

            String prompt = builder.build(task);

            assertTrue(prompt.contains(registry.schemaFor(kind).describe()), kind.getTag());
            assertTrue(prompt.contains("\"tool_name\": \"" + kind.getTag() + "\""), kind.getTag());
        }
    }

    @Test
    void testUnknownStyleFallsBackToNaturalWording() {
        GenerationTask task = new GenerationTask(1, "d", "p", ToolKind.SANDBOX_EXEC, "no-such-style");

        assertTrue(builder.build(task).contains("Write the query naturally"));
    }

    @Test
    void testPickedStylesComeFromCatalogue() {
        Random random = new Random(3);
        for (int i = 0; i < 50; i++) {
            String style = QueryStyleCatalog.pick(random);
            assertTrue(QueryStyleCatalog.find(style).isPresent(), style);
        }
        assertTrue(QueryStyleCatalog.names().contains("direct"));
    }
}
