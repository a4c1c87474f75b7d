package com.example.Bess_Analytics_Platform.exception;

/**
 * Too little data for a requested computation. Outside strict mode most
 * calculations report explicit markers instead of throwing this.
 */
public class InsufficientDataException extends RuntimeException {
    public InsufficientDataException(String message) {
        super(message);
    }
}
