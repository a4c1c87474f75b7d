package com.example.Bess_Analytics_Platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Explicit markers attached to a metrics snapshot when a value could not be
 * measured directly from the window.
 */
public enum MetricFlag {
    SOC_UNAVAILABLE,
    SOC_COULOMB_COUNTED,
    SOC_AVERAGED,
    SOH_FROM_REPORTED_CAPACITY,
    SOH_CARRIED_FORWARD,
    SOH_NOMINAL_ASSUMED,
    INSUFFICIENT_HISTORY,
    CYCLE_BASELINE_RESET;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
