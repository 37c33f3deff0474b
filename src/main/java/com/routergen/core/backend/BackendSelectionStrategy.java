package com.routergen.core.backend;

import com.routergen.core.example.GenerationTask;

import java.util.List;

/**
 * Picks a backend among those currently available.
 *
 * Called by {@link BackendPool} with its lock held, so implementations need
 * no synchronization of their own. Given the same seed and the same call
 * sequence, a strategy must return the same choices.
 */
public interface BackendSelectionStrategy {

    /**
     * @param task       the task being attempted
     * @param available  non-empty, in rotation order, excluding disabled and cooling backends
     * @param rotation   full rotation order, for "next after previous" lookups
     * @param previous   backend used by the previous attempt of this task, or null on a first attempt
     */
    Backend select(GenerationTask task, List<Backend> available, List<Backend> rotation, Backend previous);

    /**
     * First available backend strictly after {@code previous} in rotation order,
     * wrapping around. Falls back to {@code previous} only when it is the sole
     * available backend.
     */
    static Backend nextAfter(Backend previous, List<Backend> available, List<Backend> rotation) {
        int start = rotation.indexOf(previous);
        for (int step = 1; step <= rotation.size(); step++) {
            Backend candidate = rotation.get((start + step) % rotation.size());
            if (candidate != previous && available.contains(candidate)) {
                return candidate;
            }
        }
        return available.get(0);
    }
}
