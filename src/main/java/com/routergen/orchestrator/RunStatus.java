package com.routergen.orchestrator;

/**
 * How a generation run ended.
 */
public enum RunStatus {

    /** Every quota filled. */
    COMPLETED,

    /** Global attempt ceiling used up before all quotas filled. */
    ATTEMPT_CEILING_REACHED,

    /** Every backend permanently disabled. Persisted output is kept. */
    BACKENDS_EXHAUSTED,

    /** The output file could not be written. */
    OUTPUT_FAILED,

    /** The run was interrupted from outside. */
    INTERRUPTED;

    public boolean isFatal() {
        return this == BACKENDS_EXHAUSTED || this == OUTPUT_FAILED;
    }
}
