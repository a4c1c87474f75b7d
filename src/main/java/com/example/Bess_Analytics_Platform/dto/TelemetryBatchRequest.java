package com.example.Bess_Analytics_Platform.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * JSON telemetry batch for metrics computation.
 */
public class TelemetryBatchRequest {

    @NotNull
    @JsonProperty("data")
    public List<TelemetryRow> data;

    @JsonProperty("resample_seconds")
    public Long resampleSeconds;

    @JsonProperty("strict")
    public boolean strict;

    // Restart cycle counting from this value instead of the stored history
    @JsonProperty("cycle_baseline")
    public Double cycleBaseline;

    public TelemetryBatchRequest() {}

    public TelemetryBatchRequest(List<TelemetryRow> data) {
        this.data = data;
    }
}
