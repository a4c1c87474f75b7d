package com.example.Bess_Analytics_Platform.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one anomaly detection run. Count and percentage are always
 * derived from the anomaly list and the window size.
 */
public final class AnomalyReport {

    private final String batteryId;
    private final int totalSamples;
    private final List<AnomalyRecord> anomalies;
    private final Map<AnomalyType, Integer> summary;
    private final boolean statisticalPassRun;
    private final double contamination;

    public AnomalyReport(String batteryId, int totalSamples, List<AnomalyRecord> anomalies,
                         boolean statisticalPassRun, double contamination) {
        this.batteryId = Objects.requireNonNull(batteryId, "Battery ID cannot be null");
        this.totalSamples = totalSamples;
        this.anomalies = List.copyOf(anomalies);
        this.statisticalPassRun = statisticalPassRun;
        this.contamination = contamination;

        Map<AnomalyType, Integer> counts = new EnumMap<>(AnomalyType.class);
        for (AnomalyType type : AnomalyType.values()) {
            counts.put(type, 0);
        }
        for (AnomalyRecord record : this.anomalies) {
            record.getTypes().forEach(type -> counts.merge(type, 1, Integer::sum));
        }
        this.summary = Collections.unmodifiableMap(counts);
    }

    public String getBatteryId() { return batteryId; }
    public int getTotalSamples() { return totalSamples; }
    public List<AnomalyRecord> getAnomalies() { return anomalies; }
    public Map<AnomalyType, Integer> getSummary() { return summary; }
    public boolean isStatisticalPassRun() { return statisticalPassRun; }
    public double getContamination() { return contamination; }

    public int getAnomalyCount() {
        return anomalies.size();
    }

    public double getAnomalyPercentage() {
        if (totalSamples == 0) {
            return 0.0;
        }
        return 100.0 * anomalies.size() / totalSamples;
    }

    @Override
    public String toString() {
        return String.format("AnomalyReport{id='%s', samples=%d, anomalies=%d (%.2f%%), statistical=%s}",
                batteryId, totalSamples, anomalies.size(), getAnomalyPercentage(), statisticalPassRun);
    }
}
