package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.dto.TelemetryRow;
import com.example.Bess_Analytics_Platform.exception.InsufficientDataException;
import com.example.Bess_Analytics_Platform.exception.NoDataFoundException;
import com.example.Bess_Analytics_Platform.model.AnalysisOptions;
import com.example.Bess_Analytics_Platform.model.AnalysisResult;
import com.example.Bess_Analytics_Platform.model.AnomalyReport;
import com.example.Bess_Analytics_Platform.model.BatteryRecord;
import com.example.Bess_Analytics_Platform.model.Channel;
import com.example.Bess_Analytics_Platform.model.ChannelBounds;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import com.example.Bess_Analytics_Platform.model.NormalizationResult;
import com.example.Bess_Analytics_Platform.model.PeriodSummary;
import com.example.Bess_Analytics_Platform.repository.MetricsHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Entry point for analytics requests.
 *
 * Pipeline for a batch: validate detection settings, normalize, then run
 * anomaly detection on the worker pool while metrics are computed and
 * appended under the history store's per-battery lock.
 */
@Service
public class AnalyticsEngine {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsEngine.class);

    private final TelemetryNormalizer normalizer;
    private final BatteryMetricsCalculator calculator;
    private final AnomalyDetector detector;
    private final SampleWindowing windowing;
    private final MetricsHistoryRepository historyRepository;
    private final ExecutorService analyticsExecutor;

    public AnalyticsEngine(TelemetryNormalizer normalizer,
                           BatteryMetricsCalculator calculator,
                           AnomalyDetector detector,
                           SampleWindowing windowing,
                           MetricsHistoryRepository historyRepository,
                           ExecutorService analyticsExecutor) {
        this.normalizer = normalizer;
        this.calculator = calculator;
        this.detector = detector;
        this.windowing = windowing;
        this.historyRepository = historyRepository;
        this.analyticsExecutor = analyticsExecutor;
    }

    /**
     * Normalize a batch, compute and store a metrics snapshot, and detect anomalies.
     */
    public AnalysisResult process(String batteryId, List<TelemetryRow> rows, AnalysisOptions options) {
        return run(batteryId, rows, options, record -> appendMetrics(record, options));
    }

    /**
     * Same pipeline as {@link #process} against caller-supplied history
     * (oldest first). Nothing is stored.
     */
    public AnalysisResult analyze(String batteryId, List<TelemetryRow> rows, List<MetricsSnapshot> history,
                                  AnalysisOptions options) {
        return run(batteryId, rows, options, record -> calculator.compute(record, history, options));
    }

    private AnalysisResult run(String batteryId, List<TelemetryRow> rows, AnalysisOptions options,
                               Function<BatteryRecord, MetricsSnapshot> metrics) {
        double contamination = detector.resolveContamination(options.getContamination());
        Map<Channel, ChannelBounds> bounds = detector.resolveBounds(options.getThresholds());

        NormalizationResult normalization = normalizer.normalize(batteryId, rows, options.getResampleInterval());
        BatteryRecord record = normalization.getRecord();
        requireSamples(record, normalization);

        CompletableFuture<AnomalyReport> detection = CompletableFuture.supplyAsync(
                () -> detector.detect(record, bounds, contamination), analyticsExecutor);

        MetricsSnapshot snapshot;
        try {
            snapshot = metrics.apply(record);
        } catch (RuntimeException e) {
            detection.cancel(true);
            throw e;
        }

        AnomalyReport report = join(detection);
        logger.info("Processed {}: {} samples, soh={}%, {} anomalies",
                batteryId, record.size(), String.format("%.2f", snapshot.getStateOfHealth()), report.getAnomalyCount());
        return new AnalysisResult(normalization, snapshot, report);
    }

    /**
     * Compute a snapshot from the batch and the stored history, then append it.
     */
    public MetricsSnapshot computeMetrics(String batteryId, List<TelemetryRow> rows, AnalysisOptions options) {
        NormalizationResult normalization = normalizer.normalize(batteryId, rows, options.getResampleInterval());
        requireSamples(normalization.getRecord(), normalization);
        return appendMetrics(normalization.getRecord(), options);
    }

    public AnomalyReport detectAnomalies(String batteryId, List<TelemetryRow> rows, AnalysisOptions options) {
        double contamination = detector.resolveContamination(options.getContamination());
        Map<Channel, ChannelBounds> bounds = detector.resolveBounds(options.getThresholds());

        NormalizationResult normalization = normalizer.normalize(batteryId, rows, options.getResampleInterval());
        BatteryRecord record = normalization.getRecord();
        return join(CompletableFuture.supplyAsync(() -> detector.detect(record, bounds, contamination), analyticsExecutor));
    }

    /**
     * Per-period channel statistics for a batch.
     */
    public List<PeriodSummary> aggregate(String batteryId, List<TelemetryRow> rows, Duration period) {
        NormalizationResult normalization = normalizer.normalize(batteryId, rows);
        List<PeriodSummary> summaries = windowing.aggregate(normalization.getRecord().getSamples(), period);
        logger.info("Aggregated {} samples for {} into {} periods of {}",
                normalization.getAcceptedCount(), batteryId, summaries.size(), period);
        return summaries;
    }

    /**
     * @throws NoDataFoundException when nothing is stored for the battery
     */
    public MetricsSnapshot getLatestSnapshot(String batteryId) {
        return historyRepository.findLatest(batteryId)
                .orElseThrow(() -> new NoDataFoundException("No metrics stored for battery " + batteryId));
    }

    public List<MetricsSnapshot> getHistory(String batteryId) {
        List<MetricsSnapshot> history = historyRepository.loadHistory(batteryId);
        if (history.isEmpty()) {
            throw new NoDataFoundException("No metrics stored for battery " + batteryId);
        }
        return history;
    }

    public List<String> getKnownBatteries() {
        return historyRepository.findBatteryIds();
    }

    private MetricsSnapshot appendMetrics(BatteryRecord record, AnalysisOptions options) {
        return historyRepository.computeAndAppend(record.getBatteryId(),
                history -> calculator.compute(record, history, options));
    }

    private static void requireSamples(BatteryRecord record, NormalizationResult normalization) {
        if (record.isEmpty()) {
            throw new InsufficientDataException(String.format(
                    "No valid telemetry samples for battery %s (%d rows received, %d rejected)",
                    record.getBatteryId(), normalization.getInputCount(), normalization.getRejectedCount()));
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
