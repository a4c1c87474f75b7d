package com.example.Bess_Analytics_Platform.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-request knobs for the analytics engine. Anything left unset falls back
 * to the engine configuration.
 */
public final class AnalysisOptions {

    private static final AnalysisOptions DEFAULTS = builder().build();

    private final Duration resampleInterval;
    private final boolean strict;
    private final boolean resetCycleBaseline;
    private final double cycleBaseline;
    private final Double contamination;
    private final Map<Channel, ChannelBounds> thresholds;

    private AnalysisOptions(Builder builder) {
        this.resampleInterval = builder.resampleInterval;
        this.strict = builder.strict;
        this.resetCycleBaseline = builder.resetCycleBaseline;
        this.cycleBaseline = builder.cycleBaseline;
        this.contamination = builder.contamination;
        if (builder.thresholds == null) {
            this.thresholds = null;
        } else {
            Map<Channel, ChannelBounds> copy = new EnumMap<>(Channel.class);
            copy.putAll(builder.thresholds);
            this.thresholds = Collections.unmodifiableMap(copy);
        }
    }

    public static AnalysisOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Bucket length for mean resampling, null for native resolution. */
    public Duration getResampleInterval() { return resampleInterval; }

    /** Raise instead of reporting unavailable markers. */
    public boolean isStrict() { return strict; }

    /** Start cycle counting from {@link #getCycleBaseline()} instead of the stored history. */
    public boolean isResetCycleBaseline() { return resetCycleBaseline; }
    public double getCycleBaseline() { return cycleBaseline; }

    public Double getContamination() { return contamination; }

    /** Per-channel bounds, null to use the configured defaults. */
    public Map<Channel, ChannelBounds> getThresholds() { return thresholds; }

    public static final class Builder {
        private Duration resampleInterval;
        private boolean strict;
        private boolean resetCycleBaseline;
        private double cycleBaseline;
        private Double contamination;
        private Map<Channel, ChannelBounds> thresholds;

        private Builder() {}

        public Builder resampleInterval(Duration resampleInterval) { this.resampleInterval = resampleInterval; return this; }
        public Builder strict(boolean strict) { this.strict = strict; return this; }
        public Builder contamination(Double contamination) { this.contamination = contamination; return this; }
        public Builder thresholds(Map<Channel, ChannelBounds> thresholds) { this.thresholds = thresholds; return this; }

        public Builder resetCycleBaseline(double cycleBaseline) {
            this.resetCycleBaseline = true;
            this.cycleBaseline = cycleBaseline;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
