package com.example.Bess_Analytics_Platform.exception;

/**
 * Invalid analytics configuration (contamination, channel bounds, engine
 * settings). Raised before any sample is examined and scoped to one request,
 * or to application startup for engine settings.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
