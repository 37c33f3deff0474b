package com.routergen.core.dataset;

/**
 * Unchecked wrapper for I/O failures while reading or writing dataset files.
 */
public class DatasetIOException extends RuntimeException {

    public DatasetIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
