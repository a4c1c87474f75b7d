package com.example.Bess_Analytics_Platform.model;

import java.util.Locale;

/**
 * Telemetry channels that can carry operating bounds.
 */
public enum Channel {
    VOLTAGE(AnomalyType.VOLTAGE_ANOMALY),
    CURRENT(AnomalyType.CURRENT_ANOMALY),
    TEMPERATURE(AnomalyType.TEMPERATURE_ANOMALY);

    private final AnomalyType anomalyType;

    Channel(AnomalyType anomalyType) {
        this.anomalyType = anomalyType;
    }

    public AnomalyType anomalyType() {
        return anomalyType;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lookup by lower-case wire name ("voltage", "current", "temperature").
     *
     * @return the channel, or null if the name is unknown
     */
    public static Channel fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (Channel channel : values()) {
            if (channel.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return channel;
            }
        }
        return null;
    }
}
