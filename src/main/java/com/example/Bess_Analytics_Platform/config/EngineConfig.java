package com.example.Bess_Analytics_Platform.config;

import com.example.Bess_Analytics_Platform.exception.ConfigurationException;
import com.example.Bess_Analytics_Platform.model.Channel;
import com.example.Bess_Analytics_Platform.model.ChannelBounds;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable analytics settings handed to every engine component at
 * construction. Built once at startup from {@link AnalyticsProperties}.
 */
public final class EngineConfig {

    private final double ratedCapacityAh;
    private final double nominalVoltage;
    private final double goodThreshold;
    private final double warningThreshold;
    private final double minSocSwing;
    private final double defaultContamination;
    private final int minStatisticalSamples;
    private final int trees;
    private final int subsampleSize;
    private final long randomSeed;
    private final double zScoreThreshold;
    private final double suddenChangeThreshold;
    private final int patternWindow;
    private final Map<Channel, ChannelBounds> defaultBounds;
    private final int maxHistorySnapshots;
    private final int workerThreads;

    private EngineConfig(Builder builder) {
        if (!(builder.ratedCapacityAh > 0)) {
            throw new ConfigurationException("Rated capacity must be positive, got " + builder.ratedCapacityAh);
        }
        if (!(builder.nominalVoltage > 0)) {
            throw new ConfigurationException("Nominal voltage must be positive, got " + builder.nominalVoltage);
        }
        if (builder.warningThreshold < 0 || builder.goodThreshold > 100 || builder.warningThreshold > builder.goodThreshold) {
            throw new ConfigurationException(String.format(
                    "Health thresholds must satisfy 0 <= warning <= good <= 100, got warning=%.1f good=%.1f",
                    builder.warningThreshold, builder.goodThreshold));
        }
        if (builder.minSocSwing <= 0 || builder.minSocSwing > 100) {
            throw new ConfigurationException("Minimum SOC swing must be in (0, 100], got " + builder.minSocSwing);
        }
        validateContamination(builder.defaultContamination);
        if (builder.minStatisticalSamples < 2) {
            throw new ConfigurationException("Statistical pass needs at least 2 samples, got " + builder.minStatisticalSamples);
        }
        if (builder.trees < 1 || builder.subsampleSize < 2) {
            throw new ConfigurationException(String.format(
                    "Isolation forest needs trees >= 1 and subsample >= 2, got trees=%d subsample=%d",
                    builder.trees, builder.subsampleSize));
        }
        if (!(builder.zScoreThreshold > 0) || !(builder.suddenChangeThreshold > 0)) {
            throw new ConfigurationException(String.format(
                    "Z-score and sudden-change thresholds must be positive, got z=%.2f change=%.2f",
                    builder.zScoreThreshold, builder.suddenChangeThreshold));
        }
        if (builder.patternWindow < 3) {
            throw new ConfigurationException("Pattern window must hold at least 3 samples, got " + builder.patternWindow);
        }
        if (builder.maxHistorySnapshots < 2) {
            throw new ConfigurationException("History must keep at least 2 snapshots, got " + builder.maxHistorySnapshots);
        }
        if (builder.workerThreads < 1) {
            throw new ConfigurationException("Worker threads must be at least 1, got " + builder.workerThreads);
        }

        this.ratedCapacityAh = builder.ratedCapacityAh;
        this.nominalVoltage = builder.nominalVoltage;
        this.goodThreshold = builder.goodThreshold;
        this.warningThreshold = builder.warningThreshold;
        this.minSocSwing = builder.minSocSwing;
        this.defaultContamination = builder.defaultContamination;
        this.minStatisticalSamples = builder.minStatisticalSamples;
        this.trees = builder.trees;
        this.subsampleSize = builder.subsampleSize;
        this.randomSeed = builder.randomSeed;
        this.zScoreThreshold = builder.zScoreThreshold;
        this.suddenChangeThreshold = builder.suddenChangeThreshold;
        this.patternWindow = builder.patternWindow;
        this.defaultBounds = Collections.unmodifiableMap(new EnumMap<>(builder.defaultBounds));
        this.maxHistorySnapshots = builder.maxHistorySnapshots;
        this.workerThreads = builder.workerThreads;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Settings with every default; handy for tests and tools. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Contamination is the expected outlier fraction and must lie strictly
     * between 0 and 1.
     */
    public static double validateContamination(double contamination) {
        if (Double.isNaN(contamination) || contamination <= 0.0 || contamination >= 1.0) {
            throw new ConfigurationException("Contamination must be in the open interval (0, 1), got " + contamination);
        }
        return contamination;
    }

    public double getRatedCapacityAh() { return ratedCapacityAh; }
    public double getNominalVoltage() { return nominalVoltage; }
    public double getGoodThreshold() { return goodThreshold; }
    public double getWarningThreshold() { return warningThreshold; }
    public double getMinSocSwing() { return minSocSwing; }
    public double getDefaultContamination() { return defaultContamination; }
    public int getMinStatisticalSamples() { return minStatisticalSamples; }
    public int getTrees() { return trees; }
    public int getSubsampleSize() { return subsampleSize; }
    public long getRandomSeed() { return randomSeed; }
    public double getZScoreThreshold() { return zScoreThreshold; }
    public double getSuddenChangeThreshold() { return suddenChangeThreshold; }
    public int getPatternWindow() { return patternWindow; }
    public Map<Channel, ChannelBounds> getDefaultBounds() { return defaultBounds; }
    public int getMaxHistorySnapshots() { return maxHistorySnapshots; }
    public int getWorkerThreads() { return workerThreads; }

    @Override
    public String toString() {
        return String.format("EngineConfig{rated=%.1fAh, nominal=%.1fV, health=[warning>=%.1f, good>=%.1f], contamination=%.3f, bounds=%s}",
                ratedCapacityAh, nominalVoltage, warningThreshold, goodThreshold, defaultContamination, defaultBounds);
    }

    public static final class Builder {
        private double ratedCapacityAh = 100.0;
        private double nominalVoltage = 48.0;
        private double goodThreshold = 90.0;
        private double warningThreshold = 70.0;
        private double minSocSwing = 20.0;
        private double defaultContamination = 0.05;
        private int minStatisticalSamples = 20;
        private int trees = 100;
        private int subsampleSize = 256;
        private long randomSeed = 42L;
        private double zScoreThreshold = 3.0;
        private double suddenChangeThreshold = 10.0;
        private int patternWindow = 20;
        private final Map<Channel, ChannelBounds> defaultBounds = new EnumMap<>(Channel.class);
        private int maxHistorySnapshots = 500;
        private int workerThreads = 4;

        private Builder() {
            defaultBounds.put(Channel.VOLTAGE, ChannelBounds.of(40.0, 60.0));
            defaultBounds.put(Channel.CURRENT, ChannelBounds.of(-200.0, 200.0));
            defaultBounds.put(Channel.TEMPERATURE, ChannelBounds.of(0.0, 50.0));
        }

        public Builder ratedCapacityAh(double value) { this.ratedCapacityAh = value; return this; }
        public Builder nominalVoltage(double value) { this.nominalVoltage = value; return this; }
        public Builder goodThreshold(double value) { this.goodThreshold = value; return this; }
        public Builder warningThreshold(double value) { this.warningThreshold = value; return this; }
        public Builder minSocSwing(double value) { this.minSocSwing = value; return this; }
        public Builder defaultContamination(double value) { this.defaultContamination = value; return this; }
        public Builder minStatisticalSamples(int value) { this.minStatisticalSamples = value; return this; }
        public Builder trees(int value) { this.trees = value; return this; }
        public Builder subsampleSize(int value) { this.subsampleSize = value; return this; }
        public Builder randomSeed(long value) { this.randomSeed = value; return this; }
        public Builder zScoreThreshold(double value) { this.zScoreThreshold = value; return this; }
        public Builder suddenChangeThreshold(double value) { this.suddenChangeThreshold = value; return this; }
        public Builder patternWindow(int value) { this.patternWindow = value; return this; }
        public Builder maxHistorySnapshots(int value) { this.maxHistorySnapshots = value; return this; }
        public Builder workerThreads(int value) { this.workerThreads = value; return this; }

        public Builder bounds(Channel channel, ChannelBounds bounds) {
            if (bounds == null) {
                this.defaultBounds.remove(channel);
            } else {
                this.defaultBounds.put(channel, bounds);
            }
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
