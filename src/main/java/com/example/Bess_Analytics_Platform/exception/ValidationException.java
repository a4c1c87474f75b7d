package com.example.Bess_Analytics_Platform.exception;

/**
 * Telemetry input that cannot be used at all, e.g. a CSV upload without the
 * mandatory columns. Individual bad rows are dropped and counted instead.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ValidationException(String message) {
        super(message);
    }
}
