package com.geonews.api.exception;

/**
 * A trending recomputation failed and there was no earlier result to fall back on.
 */
public class RetrievalFailedException extends RuntimeException {

    public RetrievalFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
