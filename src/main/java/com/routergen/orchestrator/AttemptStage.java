package com.routergen.orchestrator;

/**
 * Stages of one generation attempt, in order. An attempt ends in PERSISTED or
 * in one of the rejection stages.
 */
public enum AttemptStage {
    REQUESTED,
    GENERATED,
    BACKEND_FAILED,
    VALIDATED,
    REJECTED,
    DEDUPLICATED,
    REJECTED_DUPLICATE,
    FORMATTED,
    PERSISTED,
    DISCARDED
}
