package com.teknolojikpanda.codereview.api;

/**
 * Fatal error that aborts a whole review session before any file is analyzed.
 */
public class ReviewSessionException extends RuntimeException {

    public ReviewSessionException(String message) {
        super(message);
    }

    public ReviewSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
