package com.example.Bess_Analytics_Platform.dto;

import com.example.Bess_Analytics_Platform.exception.ConfigurationException;
import com.example.Bess_Analytics_Platform.model.Channel;
import com.example.Bess_Analytics_Platform.model.ChannelBounds;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Anomaly detection request. Thresholds are given as
 * {"voltage": [min, max], ...}. Without a thresholds map the configured
 * defaults apply; a supplied map replaces them as a whole, so channels it
 * leaves out get no threshold check.
 */
public class AnomalyDetectionRequest {

    @NotBlank
    @JsonProperty("battery_id")
    public String batteryId;

    @NotNull
    @JsonProperty("data")
    public List<TelemetryRow> data;

    @JsonProperty("contamination")
    public Double contamination;

    @JsonProperty("thresholds")
    public Map<String, List<Double>> thresholds;

    public AnomalyDetectionRequest() {}

    public AnomalyDetectionRequest(String batteryId, List<TelemetryRow> data) {
        this.batteryId = batteryId;
        this.data = data;
    }

    /**
     * @return per-channel bounds, or null when no thresholds were sent
     * @throws ConfigurationException on an unknown channel or a malformed pair
     */
    public Map<Channel, ChannelBounds> toChannelBounds() {
        if (thresholds == null) {
            return null;
        }
        return parseThresholds(thresholds);
    }

    public static Map<Channel, ChannelBounds> parseThresholds(Map<String, List<Double>> thresholds) {
        Map<Channel, ChannelBounds> bounds = new EnumMap<>(Channel.class);
        for (Map.Entry<String, List<Double>> entry : thresholds.entrySet()) {
            Channel channel = Channel.fromKey(entry.getKey());
            if (channel == null) {
                throw new ConfigurationException("Unknown threshold channel: " + entry.getKey());
            }
            List<Double> pair = entry.getValue();
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                throw new ConfigurationException("Threshold for " + entry.getKey() + " must be [min, max]");
            }
            bounds.put(channel, ChannelBounds.of(pair.get(0), pair.get(1)));
        }
        return bounds;
    }
}
