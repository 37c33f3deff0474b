package com.routergen.core.schema;

/**
 * Search strategy declared by a codebase_search call.
 *
 *   EXACT    - literal symbol lookup ("class User", "authenticate(")
 *   SEMANTIC - concept lookup ("where are tokens validated")
 *   HYBRID   - mixed: a symbol plus surrounding intent
 */
public enum SearchMode {
    EXACT("exact"),
    SEMANTIC("semantic"),
    HYBRID("hybrid");

    private final String wire;

    SearchMode(String wire) {
        this.wire = wire;
    }

    public String getWire() {
        return wire;
    }

    public static SearchMode fromWire(String value) {
        for (SearchMode mode : values()) {
            if (mode.wire.equals(value)) return mode;
        }
        throw new IllegalArgumentException("Unknown search mode: " + value);
    }
}
