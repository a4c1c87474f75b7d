package com.example.Bess_Analytics_Platform.dto;

import com.example.Bess_Analytics_Platform.model.AnalysisResult;
import com.example.Bess_Analytics_Platform.model.NormalizationResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a full CSV upload analysis.
 */
public class ProcessDataResponse {

    @JsonProperty("battery_id")
    public String batteryId;

    @JsonProperty("rows_received")
    public int rowsReceived;

    @JsonProperty("samples_accepted")
    public int samplesAccepted;

    @JsonProperty("rows_rejected")
    public int rowsRejected;

    @JsonProperty("duplicates_dropped")
    public int duplicatesDropped;

    @JsonProperty("resampled")
    public boolean resampled;

    @JsonProperty("metrics")
    public BatteryMetricsResponse metrics;

    @JsonProperty("anomalies")
    public AnomalyDetectionResponse anomalies;

    public ProcessDataResponse() {}

    public ProcessDataResponse(AnalysisResult result) {
        NormalizationResult normalization = result.getNormalization();
        this.batteryId = normalization.getRecord().getBatteryId();
        this.rowsReceived = normalization.getInputCount();
        this.samplesAccepted = normalization.getAcceptedCount();
        this.rowsRejected = normalization.getRejectedCount();
        this.duplicatesDropped = normalization.getDuplicateCount();
        this.resampled = normalization.isResampled();
        this.metrics = new BatteryMetricsResponse(result.getSnapshot());
        this.anomalies = new AnomalyDetectionResponse(result.getAnomalies());
    }
}
