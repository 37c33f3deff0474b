package com.routergen.core.generator;

import com.routergen.llm.BackendErrorKind;

/**
 * Classified backend failure of one generation attempt.
 */
public final class BackendError {

    private final BackendErrorKind kind;
    private final String           message;

    public BackendError(BackendErrorKind kind, String message) {
        this.kind    = kind;
        this.message = message;
    }

    public BackendErrorKind getKind()    { return kind; }
    public String           getMessage() { return message; }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
