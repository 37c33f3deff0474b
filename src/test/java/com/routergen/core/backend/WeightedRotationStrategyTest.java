package com.routergen.core.backend;

import com.routergen.core.example.GenerationTask;
import com.routergen.core.schema.ToolKind;
import com.routergen.llm.LLMClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WeightedRotationStrategyTest {

    private final Backend strong  = backend("strong", EnumSet.of(BackendTag.LOGIC_STRONG));
    private final Backend diverse = backend("diverse", EnumSet.of(BackendTag.DIVERSITY));
    private final List<Backend> rotation = List.of(strong, diverse);

    @Test
    void testSameSeedSameChoices() {
        assertEquals(draw(new WeightedRotationStrategy(7), task(ToolKind.CODEBASE_SEARCH), 200),
                     draw(new WeightedRotationStrategy(7), task(ToolKind.CODEBASE_SEARCH), 200));
    }

    @Test
    void testComplexTasksPreferLogicStrongBackends() {
        List<String> picks = draw(new WeightedRotationStrategy(1), task(ToolKind.FILE_MANAGER), 2_000);
        long strongPicks = picks.stream().filter("strong"::equals).count();

        // 3:1 boost gives roughly 75%
        assertTrue(strongPicks > 1_300 && strongPicks < 1_700, "strong picks: " + strongPicks);
    }

    @Test
    void testSimpleTasksPreferDiversityBackends() {
        List<String> picks = draw(new WeightedRotationStrategy(1), task(ToolKind.SANDBOX_EXEC), 2_000);
        long diversePicks = picks.stream().filter("diverse"::equals).count();

        assertTrue(diversePicks > 1_300 && diversePicks < 1_700, "diverse picks: " + diversePicks);
    }

    @Test
    void testRetrySkipsUnavailableBackends() {
        Backend third = backend("third", Set.of());
        List<Backend> fullRotation = List.of(strong, diverse, third);

        Backend next = new WeightedRotationStrategy(1)
                .select(task(ToolKind.ASK_HUMAN), List.of(strong, third), fullRotation, strong);

        assertSame(third, next);
    }

    private List<String> draw(WeightedRotationStrategy strategy, GenerationTask task, int n) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ids.add(strategy.select(task, rotation, rotation, null).getId());
        }
        return ids;
    }

    private static GenerationTask task(ToolKind kind) {
        return new GenerationTask(1, "SaaS Billing System", "Tech Lead", kind, "casual");
    }

    private static Backend backend(String id, Set<BackendTag> tags) {
        return new Backend(id, new LLMClient() {
            @Override
            public String generate(String prompt, double temperature) {
                throw new UnsupportedOperationException();
            }

            @Override
            public String getModel() {
                return id;
            }
        }, 1.0, tags);
    }
}
