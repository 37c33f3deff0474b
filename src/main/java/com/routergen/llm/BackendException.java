package com.routergen.llm;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.util.concurrent.TimeoutException;

/**
 * Unchecked failure of a backend request, carrying its {@link BackendErrorKind}.
 */
public class BackendException extends RuntimeException {

    private final BackendErrorKind kind;

    public BackendException(BackendErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(BackendErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public BackendErrorKind getKind() {
        return kind;
    }

    /**
     * Classify a raw client exception (WebClient or RestTemplate) into a
     * BackendException. Already-classified exceptions pass through.
     */
    public static BackendException classify(String provider, Throwable ex) {
        if (ex instanceof BackendException) {
            return (BackendException) ex;
        }

        if (ex instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) ex).getStatusCode().value();
            return fromStatus(provider, status, ex);
        }
        if (ex instanceof HttpStatusCodeException) {
            int status = ((HttpStatusCodeException) ex).getStatusCode().value();
            return fromStatus(provider, status, ex);
        }
        if (hasCause(ex, TimeoutException.class)) {
            return new BackendException(BackendErrorKind.TIMEOUT, provider + " request timed out", ex);
        }
        if (ex instanceof WebClientRequestException || ex instanceof ResourceAccessException) {
            return new BackendException(BackendErrorKind.UNAVAILABLE,
                    provider + " unreachable: " + rootMessage(ex), ex);
        }
        return new BackendException(BackendErrorKind.UNAVAILABLE,
                provider + " call failed: " + rootMessage(ex), ex);
    }

    private static BackendException fromStatus(String provider, int status, Throwable ex) {
        BackendErrorKind kind;
        if (status == 429) {
            kind = BackendErrorKind.RATE_LIMITED;
        } else if (status == 401 || status == 403) {
            kind = BackendErrorKind.AUTH_FAILED;
        } else if (status == 408 || status == 504) {
            kind = BackendErrorKind.TIMEOUT;
        } else {
            kind = BackendErrorKind.UNAVAILABLE;
        }
        return new BackendException(kind, provider + " returned HTTP " + status, ex);
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Throwable cause = t;
        while (cause != null) {
            if (type.isInstance(cause)) return true;
            cause = cause.getCause();
        }
        return false;
    }

    static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
