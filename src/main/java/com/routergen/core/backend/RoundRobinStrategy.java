package com.routergen.core.backend;

import com.routergen.core.example.GenerationTask;

import java.util.List;

/**
 * Plain rotation: each first attempt takes the next available backend after
 * the one handed out last; retries take the next after the failed one.
 */
public class RoundRobinStrategy implements BackendSelectionStrategy {

    private Backend lastHandedOut;

    @Override
    public Backend select(GenerationTask task, List<Backend> available, List<Backend> rotation, Backend previous) {
        Backend anchor = previous != null ? previous : lastHandedOut;
        Backend chosen = anchor == null || !rotation.contains(anchor)
                ? available.get(0)
                : BackendSelectionStrategy.nextAfter(anchor, available, rotation);
        lastHandedOut = chosen;
        return chosen;
    }
}
