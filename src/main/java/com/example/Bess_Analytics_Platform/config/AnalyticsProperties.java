package com.example.Bess_Analytics_Platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analytics tunables bound from the "analytics" prefix.
 * Read once at startup and turned into an {@link EngineConfig}.
 */
@Component
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /**
     * Nameplate capacity of one battery in Ah.
     */
    private double ratedCapacityAh = 100.0;

    /**
     * Nominal pack voltage in V.
     */
    private double nominalVoltage = 48.0;

    private final Health health = new Health();
    private final Metrics metrics = new Metrics();
    private final Anomaly anomaly = new Anomaly();
    private final History history = new History();
    private final Engine engine = new Engine();

    public double getRatedCapacityAh() { return ratedCapacityAh; }
    public void setRatedCapacityAh(double ratedCapacityAh) { this.ratedCapacityAh = ratedCapacityAh; }

    public double getNominalVoltage() { return nominalVoltage; }
    public void setNominalVoltage(double nominalVoltage) { this.nominalVoltage = nominalVoltage; }

    public Health getHealth() { return health; }
    public Metrics getMetrics() { return metrics; }
    public Anomaly getAnomaly() { return anomaly; }
    public History getHistory() { return history; }
    public Engine getEngine() { return engine; }

    public static class Health {
        /**
         * SOH at or above this is "good".
         */
        private double goodThreshold = 90.0;

        /**
         * SOH at or above this (and below good) is "warning"; below is "critical".
         */
        private double warningThreshold = 70.0;

        public double getGoodThreshold() { return goodThreshold; }
        public void setGoodThreshold(double goodThreshold) { this.goodThreshold = goodThreshold; }
        public double getWarningThreshold() { return warningThreshold; }
        public void setWarningThreshold(double warningThreshold) { this.warningThreshold = warningThreshold; }
    }

    public static class Metrics {
        /**
         * Smallest SOC swing (percentage points) of a charge or discharge run
         * that may be used to estimate capacity.
         */
        private double minSocSwing = 20.0;

        public double getMinSocSwing() { return minSocSwing; }
        public void setMinSocSwing(double minSocSwing) { this.minSocSwing = minSocSwing; }
    }

    public static class Anomaly {
        private double defaultContamination = 0.05;
        private int minStatisticalSamples = 20;
        private int trees = 100;
        private int subsampleSize = 256;
        private long randomSeed = 42L;

        /**
         * Distance from the window mean, in standard deviations, beyond which a
         * channel value is an outlier.
         */
        private double stdDevThreshold = 3.0;

        /**
         * Largest allowed step between consecutive voltage or temperature readings.
         */
        private double suddenChangeThreshold = 10.0;

        /**
         * Trailing samples used for the rolling-deviation check on voltage and current.
         */
        private int patternWindow = 20;

        /**
         * Per-channel operating band, keyed by channel name.
         */
        private Map<String, Bounds> defaultBounds = new LinkedHashMap<>();

        public Anomaly() {
            defaultBounds.put("voltage", new Bounds(40.0, 60.0));
            defaultBounds.put("current", new Bounds(-200.0, 200.0));
            defaultBounds.put("temperature", new Bounds(0.0, 50.0));
        }

        public double getDefaultContamination() { return defaultContamination; }
        public void setDefaultContamination(double defaultContamination) { this.defaultContamination = defaultContamination; }
        public int getMinStatisticalSamples() { return minStatisticalSamples; }
        public void setMinStatisticalSamples(int minStatisticalSamples) { this.minStatisticalSamples = minStatisticalSamples; }
        public int getTrees() { return trees; }
        public void setTrees(int trees) { this.trees = trees; }
        public int getSubsampleSize() { return subsampleSize; }
        public void setSubsampleSize(int subsampleSize) { this.subsampleSize = subsampleSize; }
        public long getRandomSeed() { return randomSeed; }
        public void setRandomSeed(long randomSeed) { this.randomSeed = randomSeed; }
        public double getStdDevThreshold() { return stdDevThreshold; }
        public void setStdDevThreshold(double stdDevThreshold) { this.stdDevThreshold = stdDevThreshold; }
        public double getSuddenChangeThreshold() { return suddenChangeThreshold; }
        public void setSuddenChangeThreshold(double suddenChangeThreshold) { this.suddenChangeThreshold = suddenChangeThreshold; }
        public int getPatternWindow() { return patternWindow; }
        public void setPatternWindow(int patternWindow) { this.patternWindow = patternWindow; }
        public Map<String, Bounds> getDefaultBounds() { return defaultBounds; }
        public void setDefaultBounds(Map<String, Bounds> defaultBounds) { this.defaultBounds = defaultBounds; }
    }

    public static class Bounds {
        private double min;
        private double max;

        public Bounds() {}

        public Bounds(double min, double max) {
            this.min = min;
            this.max = max;
        }

        public double getMin() { return min; }
        public void setMin(double min) { this.min = min; }
        public double getMax() { return max; }
        public void setMax(double max) { this.max = max; }
    }

    public static class History {
        /**
         * Snapshots kept per battery; oldest are evicted first.
         */
        private int maxSnapshots = 500;

        public int getMaxSnapshots() { return maxSnapshots; }
        public void setMaxSnapshots(int maxSnapshots) { this.maxSnapshots = maxSnapshots; }
    }

    public static class Engine {
        /**
         * Threads available for running anomaly detection next to metrics.
         */
        private int workerThreads = 4;

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }
}
