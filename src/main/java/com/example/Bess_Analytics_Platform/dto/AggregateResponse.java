package com.example.Bess_Analytics_Platform.dto;

import com.example.Bess_Analytics_Platform.model.PeriodSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-period channel statistics.
 */
public class AggregateResponse {

    @JsonProperty("battery_id")
    public String batteryId;

    @JsonProperty("period_seconds")
    public long periodSeconds;

    @JsonProperty("periods")
    public List<PeriodInfo> periods;

    public AggregateResponse() {}

    public AggregateResponse(String batteryId, long periodSeconds, List<PeriodSummary> summaries) {
        this.batteryId = batteryId;
        this.periodSeconds = periodSeconds;
        this.periods = summaries.stream().map(PeriodInfo::new).collect(Collectors.toList());
    }

    public static class PeriodInfo {
        @JsonProperty("period_start")
        public Instant periodStart;

        @JsonProperty("sample_count")
        public int sampleCount;

        @JsonProperty("voltage")
        public PeriodSummary.ChannelStats voltage;

        @JsonProperty("current")
        public PeriodSummary.ChannelStats current;

        @JsonProperty("temperature")
        public PeriodSummary.ChannelStats temperature;

        @JsonProperty("soc")
        public PeriodSummary.ChannelStats soc;

        public PeriodInfo(PeriodSummary summary) {
            this.periodStart = summary.getPeriodStart();
            this.sampleCount = summary.getSampleCount();
            this.voltage = summary.getVoltage();
            this.current = summary.getCurrent();
            this.temperature = summary.getTemperature();
            this.soc = summary.getSoc();
        }
    }
}
