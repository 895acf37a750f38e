package com.geonews.api.exception;

/**
 * Malformed predicate or coordinate, rejected at the REST boundary.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
