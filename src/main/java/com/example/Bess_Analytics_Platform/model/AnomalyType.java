package com.example.Bess_Analytics_Platform.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    VOLTAGE_ANOMALY("voltage_anomaly"),
    TEMPERATURE_ANOMALY("temperature_anomaly"),
    CURRENT_ANOMALY("current_anomaly"),
    STATISTICAL_OUTLIER("statistical_outlier");

    private final String wireName;

    AnomalyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
