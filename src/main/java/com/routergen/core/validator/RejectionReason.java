package com.routergen.core.validator;

/**
 * Why a generated record was discarded.
 */
public enum RejectionReason {

    /** Not parseable, or structurally invalid against the variant schema. */
    SCHEMA_MISMATCH,

    /** tool_name missing, not text, or not a known variant. */
    DISCRIMINATOR_AMBIGUOUS,

    /** Structurally valid but inconsistent with the user query or quality thresholds. */
    DOMAIN_LOGIC_VIOLATION
}
