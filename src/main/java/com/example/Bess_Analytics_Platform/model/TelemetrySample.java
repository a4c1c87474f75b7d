package com.example.Bess_Analytics_Platform.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable telemetry observation.
 *
 * Current sign convention: positive = discharge, negative = charge
 * (same convention as the BESS power flow).
 */
public final class TelemetrySample {

    private final Instant timestamp;
    private final double voltage;     // V
    private final double current;     // A
    private final double temperature; // °C
    private final Double socReported; // % (0-100), null when not reported
    private final Double capacityReported; // Ah measured usable capacity, null when not reported

    public TelemetrySample(Instant timestamp, double voltage, double current, double temperature,
                           Double socReported, Double capacityReported) {
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.voltage = voltage;
        this.current = current;
        this.temperature = temperature;
        this.socReported = socReported;
        this.capacityReported = capacityReported;
    }

    public TelemetrySample(Instant timestamp, double voltage, double current, double temperature, Double socReported) {
        this(timestamp, voltage, current, temperature, socReported, null);
    }

    public Instant getTimestamp() { return timestamp; }
    public double getVoltage() { return voltage; }
    public double getCurrent() { return current; }
    public double getTemperature() { return temperature; }
    public Double getSocReported() { return socReported; }
    public Double getCapacityReported() { return capacityReported; }

    public boolean hasSoc() { return socReported != null; }
    public boolean hasCapacity() { return capacityReported != null; }

    /**
     * Channel value by channel, used by the threshold pass.
     */
    public double valueOf(Channel channel) {
        switch (channel) {
            case VOLTAGE:
                return voltage;
            case CURRENT:
                return current;
            case TEMPERATURE:
                return temperature;
            default:
                throw new IllegalArgumentException("Unknown channel: " + channel);
        }
    }

    /** Instantaneous power in W (positive = delivered by the battery). */
    public double power() {
        return voltage * current;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TelemetrySample that = (TelemetrySample) o;
        return Double.compare(voltage, that.voltage) == 0
                && Double.compare(current, that.current) == 0
                && Double.compare(temperature, that.temperature) == 0
                && timestamp.equals(that.timestamp)
                && Objects.equals(socReported, that.socReported)
                && Objects.equals(capacityReported, that.capacityReported);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, voltage, current, temperature, socReported, capacityReported);
    }

    @Override
    public String toString() {
        return String.format("Sample{t=%s, V=%.2f, I=%.2f, T=%.1f, soc=%s}",
                timestamp, voltage, current, temperature, socReported != null ? String.format("%.1f", socReported) : "n/a");
    }
}
