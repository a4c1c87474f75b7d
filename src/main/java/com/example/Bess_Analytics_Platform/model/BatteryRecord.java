package com.example.Bess_Analytics_Platform.model;

import java.util.List;
import java.util.Objects;

/**
 * A battery identifier plus its telemetry, ordered by timestamp.
 * Request-scoped; persisted only through the history store's snapshots.
 */
public final class BatteryRecord {

    private final String batteryId;
    private final List<TelemetrySample> samples;

    public BatteryRecord(String batteryId, List<TelemetrySample> samples) {
        this.batteryId = Objects.requireNonNull(batteryId, "Battery ID cannot be null");
        this.samples = List.copyOf(samples);
    }

    public String getBatteryId() { return batteryId; }
    public List<TelemetrySample> getSamples() { return samples; }

    public int size() { return samples.size(); }
    public boolean isEmpty() { return samples.isEmpty(); }

    public TelemetrySample first() {
        return samples.isEmpty() ? null : samples.get(0);
    }

    public TelemetrySample last() {
        return samples.isEmpty() ? null : samples.get(samples.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatteryRecord that = (BatteryRecord) o;
        return batteryId.equals(that.batteryId) && samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(batteryId, samples);
    }

    @Override
    public String toString() {
        return String.format("BatteryRecord{id='%s', samples=%d}", batteryId, samples.size());
    }
}
