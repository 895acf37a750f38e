package com.geonews.api.exception;

import java.io.IOException;

/**
 * The NLP provider could not produce an analysis (no credentials, timeout, bad response).
 */
public class NlpUnavailableException extends IOException {

    public NlpUnavailableException(String message) {
        super(message);
    }

    public NlpUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
