package com.example.Bess_Analytics_Platform.model;

/**
 * Output of one full pass over a telemetry batch.
 */
public final class AnalysisResult {

    private final NormalizationResult normalization;
    private final MetricsSnapshot snapshot;
    private final AnomalyReport anomalies;

    public AnalysisResult(NormalizationResult normalization, MetricsSnapshot snapshot, AnomalyReport anomalies) {
        this.normalization = normalization;
        this.snapshot = snapshot;
        this.anomalies = anomalies;
    }

    public NormalizationResult getNormalization() { return normalization; }
    public MetricsSnapshot getSnapshot() { return snapshot; }
    public AnomalyReport getAnomalies() { return anomalies; }

    @Override
    public String toString() {
        return String.format("AnalysisResult{%s, %s, %s}", normalization, snapshot, anomalies);
    }
}
