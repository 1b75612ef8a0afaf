package com.whereq.arbiter.exception;

/**
 * Base class for errors raised by the analysis scheduler
 */
public class ArbiterException extends RuntimeException {
    public ArbiterException(String message) {
        super(message);
    }

    public ArbiterException(String message, Throwable cause) {
        super(message, cause);
    }
}
