package com.example.Bess_Analytics_Platform.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Request for per-period channel statistics.
 */
public class AggregateRequest {

    @NotBlank
    @JsonProperty("battery_id")
    public String batteryId;

    @NotNull
    @JsonProperty("data")
    public List<TelemetryRow> data;

    @Positive
    @JsonProperty("period_seconds")
    public long periodSeconds = 3600;

    public AggregateRequest() {}
}
