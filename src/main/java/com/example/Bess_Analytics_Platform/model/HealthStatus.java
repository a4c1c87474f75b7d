package com.example.Bess_Analytics_Platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Health classification derived from state of health.
 */
public enum HealthStatus {
    GOOD,
    WARNING,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
