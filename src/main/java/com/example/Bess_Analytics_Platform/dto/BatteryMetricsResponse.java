package com.example.Bess_Analytics_Platform.dto;

import com.example.Bess_Analytics_Platform.model.HealthStatus;
import com.example.Bess_Analytics_Platform.model.MetricFlag;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Set;

/**
 * Metrics snapshot as returned over the API.
 */
public class BatteryMetricsResponse {

    @JsonProperty("battery_id")
    public String batteryId;

    @JsonProperty("timestamp")
    public Instant timestamp;

    @JsonProperty("state_of_health")
    public double stateOfHealth; // %

    @JsonProperty("current_soc")
    public Double currentSoc; // %, null when unavailable

    @JsonProperty("avg_voltage")
    public double avgVoltage;

    @JsonProperty("avg_current")
    public double avgCurrent;

    @JsonProperty("avg_temperature")
    public double avgTemperature;

    @JsonProperty("max_temperature")
    public double maxTemperature;

    @JsonProperty("voltage_std")
    public double voltageStd;

    @JsonProperty("full_cycles")
    public long fullCycles;

    @JsonProperty("equivalent_cycles")
    public double equivalentCycles;

    @JsonProperty("degradation_rate")
    public double degradationRate; // % SOH per 30 days

    @JsonProperty("degradation_per_cycle")
    public double degradationPerCycle;

    @JsonProperty("energy_efficiency")
    public Double energyEfficiency;

    @JsonProperty("health_status")
    public HealthStatus healthStatus;

    @JsonProperty("sample_count")
    public int sampleCount;

    @JsonProperty("flags")
    public Set<MetricFlag> flags;

    public BatteryMetricsResponse() {}

    public BatteryMetricsResponse(MetricsSnapshot snapshot) {
        this.batteryId = snapshot.getBatteryId();
        this.timestamp = snapshot.getTimestamp();
        this.stateOfHealth = snapshot.getStateOfHealth();
        this.currentSoc = snapshot.getStateOfCharge();
        this.avgVoltage = snapshot.getAvgVoltage();
        this.avgCurrent = snapshot.getAvgCurrent();
        this.avgTemperature = snapshot.getAvgTemperature();
        this.maxTemperature = snapshot.getMaxTemperature();
        this.voltageStd = snapshot.getVoltageStdDev();
        this.fullCycles = snapshot.getFullCycles();
        this.equivalentCycles = snapshot.getEquivalentCycles();
        this.degradationRate = snapshot.getDegradationRate();
        this.degradationPerCycle = snapshot.getDegradationPerCycle();
        this.energyEfficiency = snapshot.getEnergyEfficiency();
        this.healthStatus = snapshot.getHealthStatus();
        this.sampleCount = snapshot.getSampleCount();
        this.flags = snapshot.getFlags();
    }
}
