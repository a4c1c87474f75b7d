package com.example.Bess_Analytics_Platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Aggregate statistics for one fixed-length period of telemetry.
 */
public final class PeriodSummary {

    private final Instant periodStart;
    private final int sampleCount;
    private final ChannelStats voltage;
    private final ChannelStats current;
    private final ChannelStats temperature;
    private final ChannelStats soc; // null when no sample in the period reported SOC

    public PeriodSummary(Instant periodStart, int sampleCount, ChannelStats voltage,
                         ChannelStats current, ChannelStats temperature, ChannelStats soc) {
        this.periodStart = periodStart;
        this.sampleCount = sampleCount;
        this.voltage = voltage;
        this.current = current;
        this.temperature = temperature;
        this.soc = soc;
    }

    public Instant getPeriodStart() { return periodStart; }
    public int getSampleCount() { return sampleCount; }
    public ChannelStats getVoltage() { return voltage; }
    public ChannelStats getCurrent() { return current; }
    public ChannelStats getTemperature() { return temperature; }
    public ChannelStats getSoc() { return soc; }

    public static final class ChannelStats {
        private final double mean;
        private final double min;
        private final double max;
        private final double stdDev;

        public ChannelStats(double mean, double min, double max, double stdDev) {
            this.mean = mean;
            this.min = min;
            this.max = max;
            this.stdDev = stdDev;
        }

        public double getMean() { return mean; }
        public double getMin() { return min; }
        public double getMax() { return max; }
        @JsonProperty("std_dev")
        public double getStdDev() { return stdDev; }
    }
}
