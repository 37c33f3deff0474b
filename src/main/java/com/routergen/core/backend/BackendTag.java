package com.routergen.core.backend;

/**
 * Capability hints used by the selection strategy.
 *
 *   LOGIC_STRONG - preferred for kinds that need careful reasoning (file paths, escalation)
 *   DIVERSITY    - preferred for everything else, to widen phrasing variety
 */
public enum BackendTag {
    LOGIC_STRONG,
    DIVERSITY
}
