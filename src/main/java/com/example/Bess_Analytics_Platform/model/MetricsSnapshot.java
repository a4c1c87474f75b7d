package com.example.Bess_Analytics_Platform.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Point-in-time battery metrics produced by one calculator run.
 * Percentages are clamped to [0, 100] on construction.
 */
public final class MetricsSnapshot {

    private final String batteryId;
    private final Instant timestamp;
    private final double stateOfHealth;      // %
    private final Double stateOfCharge;      // %, null when unavailable
    private final double avgVoltage;         // V
    private final double avgCurrent;         // A
    private final double avgTemperature;     // °C
    private final double maxTemperature;     // °C
    private final double voltageStdDev;      // V
    private final double equivalentCycles;
    private final double degradationRate;    // % SOH per 30 days
    private final double degradationPerCycle; // % SOH per equivalent cycle
    private final Double energyEfficiency;   // %, null when nothing was charged
    private final HealthStatus healthStatus;
    private final int sampleCount;
    private final Set<MetricFlag> flags;

    private MetricsSnapshot(Builder builder) {
        this.batteryId = Objects.requireNonNull(builder.batteryId, "Battery ID cannot be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "Timestamp cannot be null");
        this.stateOfHealth = clampPercent(builder.stateOfHealth);
        this.stateOfCharge = builder.stateOfCharge != null ? clampPercent(builder.stateOfCharge) : null;
        this.avgVoltage = builder.avgVoltage;
        this.avgCurrent = builder.avgCurrent;
        this.avgTemperature = builder.avgTemperature;
        this.maxTemperature = builder.maxTemperature;
        this.voltageStdDev = builder.voltageStdDev;
        this.equivalentCycles = Math.max(0.0, builder.equivalentCycles);
        this.degradationRate = Math.max(0.0, builder.degradationRate);
        this.degradationPerCycle = Math.max(0.0, builder.degradationPerCycle);
        this.energyEfficiency = builder.energyEfficiency != null ? clampPercent(builder.energyEfficiency) : null;
        this.healthStatus = Objects.requireNonNull(builder.healthStatus, "Health status cannot be null");
        this.sampleCount = builder.sampleCount;
        this.flags = builder.flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static double clampPercent(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    public String getBatteryId() { return batteryId; }
    public Instant getTimestamp() { return timestamp; }
    public double getStateOfHealth() { return stateOfHealth; }
    public Double getStateOfCharge() { return stateOfCharge; }
    public double getAvgVoltage() { return avgVoltage; }
    public double getAvgCurrent() { return avgCurrent; }
    public double getAvgTemperature() { return avgTemperature; }
    public double getMaxTemperature() { return maxTemperature; }
    public double getVoltageStdDev() { return voltageStdDev; }
    public double getEquivalentCycles() { return equivalentCycles; }
    public double getDegradationRate() { return degradationRate; }
    public double getDegradationPerCycle() { return degradationPerCycle; }
    public Double getEnergyEfficiency() { return energyEfficiency; }
    public HealthStatus getHealthStatus() { return healthStatus; }
    public int getSampleCount() { return sampleCount; }
    public Set<MetricFlag> getFlags() { return flags; }

    /** Whole equivalent cycles completed over the battery's lifetime. */
    public long getFullCycles() {
        return (long) Math.floor(equivalentCycles);
    }

    public boolean hasFlag(MetricFlag flag) {
        return flags.contains(flag);
    }

    @Override
    public String toString() {
        return String.format("MetricsSnapshot{id='%s', t=%s, soh=%.2f%%, soc=%s, cycles=%.3f, degradation=%.4f%%/30d, status=%s, flags=%s}",
                batteryId, timestamp, stateOfHealth,
                stateOfCharge != null ? String.format("%.1f%%", stateOfCharge) : "n/a",
                equivalentCycles, degradationRate, healthStatus, flags);
    }

    public static final class Builder {
        private String batteryId;
        private Instant timestamp;
        private double stateOfHealth = 100.0;
        private Double stateOfCharge;
        private double avgVoltage;
        private double avgCurrent;
        private double avgTemperature;
        private double maxTemperature;
        private double voltageStdDev;
        private double equivalentCycles;
        private double degradationRate;
        private double degradationPerCycle;
        private Double energyEfficiency;
        private HealthStatus healthStatus;
        private int sampleCount;
        private final Set<MetricFlag> flags = EnumSet.noneOf(MetricFlag.class);

        private Builder() {}

        public Builder batteryId(String batteryId) { this.batteryId = batteryId; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder stateOfHealth(double stateOfHealth) { this.stateOfHealth = stateOfHealth; return this; }
        public Builder stateOfCharge(Double stateOfCharge) { this.stateOfCharge = stateOfCharge; return this; }
        public Builder avgVoltage(double avgVoltage) { this.avgVoltage = avgVoltage; return this; }
        public Builder avgCurrent(double avgCurrent) { this.avgCurrent = avgCurrent; return this; }
        public Builder avgTemperature(double avgTemperature) { this.avgTemperature = avgTemperature; return this; }
        public Builder maxTemperature(double maxTemperature) { this.maxTemperature = maxTemperature; return this; }
        public Builder voltageStdDev(double voltageStdDev) { this.voltageStdDev = voltageStdDev; return this; }
        public Builder equivalentCycles(double equivalentCycles) { this.equivalentCycles = equivalentCycles; return this; }
        public Builder degradationRate(double degradationRate) { this.degradationRate = degradationRate; return this; }
        public Builder degradationPerCycle(double degradationPerCycle) { this.degradationPerCycle = degradationPerCycle; return this; }
        public Builder energyEfficiency(Double energyEfficiency) { this.energyEfficiency = energyEfficiency; return this; }
        public Builder healthStatus(HealthStatus healthStatus) { this.healthStatus = healthStatus; return this; }
        public Builder sampleCount(int sampleCount) { this.sampleCount = sampleCount; return this; }
        public Builder flag(MetricFlag flag) { this.flags.add(flag); return this; }

        public MetricsSnapshot build() {
            return new MetricsSnapshot(this);
        }
    }
}
