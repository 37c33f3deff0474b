package com.routergen.core.backend;

/**
 * Thrown by {@link BackendPool#acquire} when no backend can be handed out.
 *
 * Fatal when every backend is permanently disabled; the run must stop.
 * Non-fatal when the wait timed out or the caller was interrupted.
 */
public class NoBackendAvailableException extends RuntimeException {

    private final boolean fatal;

    public NoBackendAvailableException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
