package com.example.Bess_Analytics_Platform.dto;

import com.example.Bess_Analytics_Platform.model.AnomalyRecord;
import com.example.Bess_Analytics_Platform.model.AnomalyReport;
import com.example.Bess_Analytics_Platform.model.AnomalyType;
import com.example.Bess_Analytics_Platform.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Anomaly report as returned over the API.
 */
public class AnomalyDetectionResponse {

    @JsonProperty("battery_id")
    public String batteryId;

    @JsonProperty("anomaly_count")
    public int anomalyCount;

    @JsonProperty("anomaly_percentage")
    public double anomalyPercentage;

    @JsonProperty("total_samples")
    public int totalSamples;

    @JsonProperty("statistical_pass_run")
    public boolean statisticalPassRun;

    @JsonProperty("contamination")
    public double contamination;

    @JsonProperty("summary")
    public Map<String, Integer> summary;

    @JsonProperty("anomalies")
    public List<AnomalyInfo> anomalies;

    public AnomalyDetectionResponse() {}

    public AnomalyDetectionResponse(AnomalyReport report) {
        this.batteryId = report.getBatteryId();
        this.anomalyCount = report.getAnomalyCount();
        this.anomalyPercentage = round2(report.getAnomalyPercentage());
        this.totalSamples = report.getTotalSamples();
        this.statisticalPassRun = report.isStatisticalPassRun();
        this.contamination = report.getContamination();
        this.summary = new LinkedHashMap<>();
        for (Map.Entry<AnomalyType, Integer> entry : report.getSummary().entrySet()) {
            summary.put(entry.getKey().wireName(), entry.getValue());
        }
        this.anomalies = report.getAnomalies().stream()
                .map(AnomalyInfo::new)
                .collect(Collectors.toList());
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public static class AnomalyInfo {
        @JsonProperty("timestamp")
        public Instant timestamp;

        @JsonProperty("sample_index")
        public int sampleIndex;

        @JsonProperty("types")
        public Set<AnomalyType> types;

        @JsonProperty("values")
        public Map<String, Double> values;

        @JsonProperty("outlier_score")
        public Double outlierScore;

        @JsonProperty("severity")
        public Severity severity;

        public AnomalyInfo() {}

        public AnomalyInfo(AnomalyRecord record) {
            this.timestamp = record.getTimestamp();
            this.sampleIndex = record.getSampleIndex();
            this.types = record.getTypes();
            this.values = record.getValues();
            this.outlierScore = record.getOutlierScore();
            this.severity = record.getSeverity();
        }
    }
}
