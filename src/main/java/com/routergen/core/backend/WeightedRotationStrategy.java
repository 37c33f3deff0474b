package com.routergen.core.backend;

import com.routergen.core.example.GenerationTask;

import java.util.List;
import java.util.Random;

/**
 * Weighted draw for first attempts, rotation for retries.
 *
 * Complex-reasoning tasks multiply the weight of LOGIC_STRONG backends,
 * all other tasks multiply DIVERSITY backends. Deterministic for a fixed seed.
 */
public class WeightedRotationStrategy implements BackendSelectionStrategy {

    static final double PREFERENCE_BOOST = 3.0;

    private final Random random;

    public WeightedRotationStrategy(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public Backend select(GenerationTask task, List<Backend> available, List<Backend> rotation, Backend previous) {
        if (previous != null) {
            return BackendSelectionStrategy.nextAfter(previous, available, rotation);
        }

        BackendTag preferred = task.requiresComplexReasoning() ? BackendTag.LOGIC_STRONG : BackendTag.DIVERSITY;

        double total = 0;
        double[] weights = new double[available.size()];
        for (int i = 0; i < available.size(); i++) {
            Backend b = available.get(i);
            weights[i] = b.getWeight() * (b.hasTag(preferred) ? PREFERENCE_BOOST : 1.0);
            total += weights[i];
        }

        double draw = random.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            draw -= weights[i];
            if (draw < 0) {
                return available.get(i);
            }
        }
        return available.get(available.size() - 1);
    }
}
