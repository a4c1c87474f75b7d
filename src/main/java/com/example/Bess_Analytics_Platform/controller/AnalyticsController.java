package com.example.Bess_Analytics_Platform.controller;

import com.example.Bess_Analytics_Platform.dto.AggregateRequest;
import com.example.Bess_Analytics_Platform.dto.AggregateResponse;
import com.example.Bess_Analytics_Platform.dto.AnomalyDetectionRequest;
import com.example.Bess_Analytics_Platform.dto.AnomalyDetectionResponse;
import com.example.Bess_Analytics_Platform.dto.BatteryMetricsResponse;
import com.example.Bess_Analytics_Platform.dto.ProcessDataResponse;
import com.example.Bess_Analytics_Platform.dto.TelemetryBatchRequest;
import com.example.Bess_Analytics_Platform.dto.TelemetryRow;
import com.example.Bess_Analytics_Platform.exception.ValidationException;
import com.example.Bess_Analytics_Platform.model.AnalysisOptions;
import com.example.Bess_Analytics_Platform.model.AnalysisResult;
import com.example.Bess_Analytics_Platform.model.AnomalyReport;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import com.example.Bess_Analytics_Platform.model.PeriodSummary;
import com.example.Bess_Analytics_Platform.service.AnalyticsEngine;
import com.example.Bess_Analytics_Platform.service.CsvTelemetryParser;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for battery analytics
 *
 * Endpoints:
 * - CSV upload with full analysis (metrics + anomalies)
 * - Metrics computation and stored snapshot history
 * - Anomaly detection with per-request thresholds
 * - Per-period aggregation
 *
 * Errors are translated by GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = "*")
public class AnalyticsController {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsController.class);

    private final AnalyticsEngine engine;
    private final CsvTelemetryParser csvParser;

    public AnalyticsController(AnalyticsEngine engine, CsvTelemetryParser csvParser) {
        this.engine = engine;
        this.csvParser = csvParser;
    }

    /**
     * Upload a CSV telemetry file and run the full analysis
     *
     * POST /api/v1/process (multipart: file, battery_id, resample_seconds?, strict?)
     */
    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProcessDataResponse> processData(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "battery_id", defaultValue = "default") String batteryId,
            @RequestParam(value = "resample_seconds", required = false) Long resampleSeconds,
            @RequestParam(value = "strict", defaultValue = "false") boolean strict) {

        logger.info("Processing upload {} for battery {}", file.getOriginalFilename(), batteryId);

        List<TelemetryRow> rows = csvParser.parse(readFile(file));
        AnalysisOptions options = AnalysisOptions.builder()
                .resampleInterval(toDuration(resampleSeconds))
                .strict(strict)
                .build();

        AnalysisResult result = engine.process(batteryId, rows, options);
        return ResponseEntity.ok(new ProcessDataResponse(result));
    }

    /**
     * Compute metrics for a JSON telemetry batch and append them to the history
     *
     * POST /api/v1/metrics/{battery_id}
     */
    @PostMapping("/metrics/{battery_id}")
    public ResponseEntity<BatteryMetricsResponse> computeMetrics(
            @PathVariable("battery_id") String batteryId,
            @Valid @RequestBody TelemetryBatchRequest request) {

        AnalysisOptions.Builder options = AnalysisOptions.builder()
                .resampleInterval(toDuration(request.resampleSeconds))
                .strict(request.strict);
        if (request.cycleBaseline != null) {
            options.resetCycleBaseline(request.cycleBaseline);
        }

        MetricsSnapshot snapshot = engine.computeMetrics(batteryId, request.data, options.build());
        logger.info("Metrics computed for {}: soh={}%, status={}", batteryId,
                String.format("%.2f", snapshot.getStateOfHealth()), snapshot.getHealthStatus());
        return ResponseEntity.ok(new BatteryMetricsResponse(snapshot));
    }

    /**
     * Latest stored snapshot
     *
     * GET /api/v1/metrics/{battery_id}
     */
    @GetMapping("/metrics/{battery_id}")
    public ResponseEntity<BatteryMetricsResponse> getLatestMetrics(@PathVariable("battery_id") String batteryId) {
        return ResponseEntity.ok(new BatteryMetricsResponse(engine.getLatestSnapshot(batteryId)));
    }

    /**
     * All stored snapshots, oldest first
     *
     * GET /api/v1/metrics/{battery_id}/history
     */
    @GetMapping("/metrics/{battery_id}/history")
    public ResponseEntity<List<BatteryMetricsResponse>> getMetricsHistory(@PathVariable("battery_id") String batteryId) {
        List<BatteryMetricsResponse> history = engine.getHistory(batteryId).stream()
                .map(BatteryMetricsResponse::new)
                .collect(Collectors.toList());
        return ResponseEntity.ok(history);
    }

    /**
     * Detect anomalies in a telemetry batch
     *
     * POST /api/v1/anomalies/detect
     */
    @PostMapping("/anomalies/detect")
    public ResponseEntity<AnomalyDetectionResponse> detectAnomalies(@Valid @RequestBody AnomalyDetectionRequest request) {
        AnalysisOptions options = AnalysisOptions.builder()
                .contamination(request.contamination)
                .thresholds(request.toChannelBounds())
                .build();

        AnomalyReport report = engine.detectAnomalies(request.batteryId, request.data, options);
        return ResponseEntity.ok(new AnomalyDetectionResponse(report));
    }

    /**
     * Per-period channel statistics
     *
     * POST /api/v1/aggregate
     */
    @PostMapping("/aggregate")
    public ResponseEntity<AggregateResponse> aggregate(@Valid @RequestBody AggregateRequest request) {
        List<PeriodSummary> summaries = engine.aggregate(request.batteryId, request.data,
                Duration.ofSeconds(request.periodSeconds));
        return ResponseEntity.ok(new AggregateResponse(request.batteryId, request.periodSeconds, summaries));
    }

    /**
     * Feature status
     *
     * GET /api/v1/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "operational");
        status.put("features", Map.of(
                "metrics_calculation", true,
                "anomaly_detection", true,
                "aggregation", true,
                "csv_upload", true));
        status.put("tracked_batteries", engine.getKnownBatteries());
        status.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(status);
    }

    private static String readFile(MultipartFile file) {
        try {
            return new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ValidationException("Unable to read uploaded file: " + e.getMessage(), e);
        }
    }

    private static Duration toDuration(Long seconds) {
        return seconds != null ? Duration.ofSeconds(seconds) : null;
    }
}
