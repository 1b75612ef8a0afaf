package com.whereq.arbiter.exception;

/**
 * Exception thrown when host resource usage cannot be read
 */
public class TelemetryException extends ArbiterException {
    public TelemetryException(String message) {
        super(message);
    }

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
