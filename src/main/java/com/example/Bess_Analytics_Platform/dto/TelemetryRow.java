package com.example.Bess_Analytics_Platform.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw telemetry row as received (JSON or CSV). Values are kept as text so the
 * normalizer can decide per row whether it is usable.
 */
public class TelemetryRow {

    @JsonProperty("timestamp")
    public String timestamp;

    @JsonProperty("voltage")
    public String voltage;

    @JsonProperty("current")
    public String current;

    @JsonProperty("temperature")
    public String temperature;

    @JsonProperty("soc")
    @JsonAlias({"soc_reported", "state_of_charge"})
    public String soc; // optional

    @JsonProperty("capacity")
    public String capacity; // optional, measured usable Ah

    public TelemetryRow() {}

    public TelemetryRow(String timestamp, String voltage, String current, String temperature, String soc) {
        this.timestamp = timestamp;
        this.voltage = voltage;
        this.current = current;
        this.temperature = temperature;
        this.soc = soc;
    }

    public static TelemetryRow of(String timestamp, double voltage, double current, double temperature, Double soc) {
        return new TelemetryRow(timestamp, String.valueOf(voltage), String.valueOf(current),
                String.valueOf(temperature), soc != null ? String.valueOf(soc) : null);
    }

    @Override
    public String toString() {
        return String.format("TelemetryRow{t=%s, V=%s, I=%s, T=%s, soc=%s, capacity=%s}",
                timestamp, voltage, current, temperature, soc, capacity);
    }
}
