package com.routergen.llm;

/**
 * Classified failure of a single backend request. Drives the BackendPool's
 * cooldown, demotion and disable decisions.
 */
public enum BackendErrorKind {

    /** Request did not complete within the configured timeout. */
    TIMEOUT,

    /** HTTP 429 or provider quota signal. Starts a cooldown. */
    RATE_LIMITED,

    /** Response arrived but could not be read as model text (including empty text). */
    MALFORMED_RESPONSE,

    /** 5xx, connection refused, DNS, any other transport failure. */
    UNAVAILABLE,

    /** 401/403. Only repeated occurrences disable a backend. */
    AUTH_FAILED
}
