package com.routergen.core.generator;

import com.routergen.core.backend.Backend;

/**
 * Outcome of one Generator call: raw model text, or a classified backend error.
 * Build via {@link #ok} / {@link #failed}.
 */
public final class GenerationResult {

    private final Backend      backend;
    private final String       rawText;
    private final BackendError error;

    private GenerationResult(Backend backend, String rawText, BackendError error) {
        this.backend = backend;
        this.rawText = rawText;
        this.error   = error;
    }

    public static GenerationResult ok(Backend backend, String rawText) {
        return new GenerationResult(backend, rawText, null);
    }

    public static GenerationResult failed(Backend backend, BackendError error) {
        return new GenerationResult(backend, null, error);
    }

    public boolean      isSuccess()  { return error == null; }
    public Backend      getBackend() { return backend; }
    public String       getRawText() { return rawText; }
    public BackendError getError()   { return error; }
}
