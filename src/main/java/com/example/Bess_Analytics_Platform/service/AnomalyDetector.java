package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.config.EngineConfig;
import com.example.Bess_Analytics_Platform.model.AnomalyRecord;
import com.example.Bess_Analytics_Platform.model.AnomalyReport;
import com.example.Bess_Analytics_Platform.model.AnomalyType;
import com.example.Bess_Analytics_Platform.model.BatteryRecord;
import com.example.Bess_Analytics_Platform.model.Channel;
import com.example.Bess_Analytics_Platform.model.ChannelBounds;
import com.example.Bess_Analytics_Platform.model.Severity;
import com.example.Bess_Analytics_Platform.model.TelemetrySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Battery anomaly detection.
 *
 * Two passes over the same normalized window, unioned per sample:
 * 1. Threshold pass: a channel value strictly outside its [min, max] band is
 *    flagged as {channel}_anomaly. Values on a bound are normal.
 * 2. Statistical pass, flagging statistical_outlier. Skipped (and reported
 *    as not run) below the configured minimum window.
 *    - Isolation forest: every sample is scored by the {@link OutlierScorer}
 *      on voltage, current, temperature and their rates of change. Of the top
 *      floor(contamination * n) scores, only those strictly above the next
 *      ranked score are flagged, so a window of tied scores flags nothing.
 *    - Z-score: a channel value further than the configured number of
 *      standard deviations from the window mean.
 *    - Sudden change: a voltage or temperature step from the previous sample
 *      larger than the configured threshold.
 *    - Pattern deviation: a voltage or current value further than the same
 *      number of standard deviations from the mean of its trailing window
 *      (the sample itself included).
 *
 * Contamination and bounds are validated before any sample is examined.
 */
@Service
public class AnomalyDetector {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetector.class);

    // Severity breakpoints
    private static final double HIGH_EXCEEDANCE = 0.25;   // fraction of band width outside the band
    private static final double MEDIUM_EXCEEDANCE = 0.10;
    private static final double HIGH_SCORE = 0.70;        // isolation score
    private static final double MEDIUM_SCORE = 0.60;
    private static final double HIGH_MULTIPLE = 2.0;      // z-score or step at twice its threshold
    private static final double MIN_STD_DEV = 1e-12;

    private static final Channel[] SUDDEN_CHANGE_CHANNELS = {Channel.VOLTAGE, Channel.TEMPERATURE};
    private static final Channel[] PATTERN_CHANNELS = {Channel.VOLTAGE, Channel.CURRENT};

    private final EngineConfig config;
    private final OutlierScorer scorer;

    public AnomalyDetector(EngineConfig config, OutlierScorer scorer) {
        this.config = config;
        this.scorer = scorer;
    }

    /**
     * Detect with the configured default bounds and contamination.
     */
    public AnomalyReport detect(BatteryRecord record) {
        return detect(record, null, null);
    }

    /**
     * @param thresholds    per-channel bounds replacing the configured defaults as a whole,
     *                      or null for the defaults
     * @param contamination expected outlier fraction in (0, 1), or null for the default
     */
    public AnomalyReport detect(BatteryRecord record, Map<Channel, ChannelBounds> thresholds, Double contamination) {
        double resolvedContamination = resolveContamination(contamination);
        Map<Channel, ChannelBounds> bounds = resolveBounds(thresholds);

        List<TelemetrySample> samples = record.getSamples();
        int n = samples.size();
        Map<Integer, Flags> flagged = new TreeMap<>();

        thresholdPass(samples, bounds, flagged);

        boolean statisticalPassRun = n >= config.getMinStatisticalSamples();
        if (statisticalPassRun) {
            statisticalPass(samples, resolvedContamination, flagged);
        } else {
            logger.debug("Skipping statistical pass for {}: {} samples < {} required",
                    record.getBatteryId(), n, config.getMinStatisticalSamples());
        }

        List<AnomalyRecord> anomalies = new ArrayList<>(flagged.size());
        for (Map.Entry<Integer, Flags> entry : flagged.entrySet()) {
            int index = entry.getKey();
            Flags flags = entry.getValue();
            anomalies.add(new AnomalyRecord(samples.get(index).getTimestamp(), index, flags.types,
                    flags.values, flags.outlierScore, flags.severity));
        }

        AnomalyReport report = new AnomalyReport(record.getBatteryId(), n, anomalies, statisticalPassRun, resolvedContamination);
        logger.info("Anomaly detection for {}: {}/{} samples flagged, summary={}",
                record.getBatteryId(), report.getAnomalyCount(), n, report.getSummary());
        return report;
    }

    /**
     * Validate a requested contamination, falling back to the configured default.
     */
    public double resolveContamination(Double contamination) {
        return EngineConfig.validateContamination(contamination != null ? contamination : config.getDefaultContamination());
    }

    /**
     * Caller bounds are used as given; channels missing from them are not checked.
     */
    public Map<Channel, ChannelBounds> resolveBounds(Map<Channel, ChannelBounds> thresholds) {
        return thresholds != null ? thresholds : config.getDefaultBounds();
    }

    private void thresholdPass(List<TelemetrySample> samples, Map<Channel, ChannelBounds> bounds, Map<Integer, Flags> flagged) {
        for (Map.Entry<Channel, ChannelBounds> entry : bounds.entrySet()) {
            Channel channel = entry.getKey();
            ChannelBounds band = entry.getValue();
            for (int i = 0; i < samples.size(); i++) {
                double value = samples.get(i).valueOf(channel);
                if (band.isViolatedBy(value)) {
                    double exceedance = band.relativeExceedance(value);
                    Severity severity = exceedance > HIGH_EXCEEDANCE ? Severity.HIGH
                            : exceedance > MEDIUM_EXCEEDANCE ? Severity.MEDIUM : Severity.LOW;
                    flagged.computeIfAbsent(i, k -> new Flags()).add(channel.anomalyType(), severity)
                            .values.put(channel.key(), value);
                }
            }
        }
    }

    private void statisticalPass(List<TelemetrySample> samples, double contamination, Map<Integer, Flags> flagged) {
        int forest = isolationForestPass(samples, contamination, flagged);
        int zScores = zScorePass(samples, flagged);
        int steps = suddenChangePass(samples, flagged);
        int deviations = patternDeviationPass(samples, flagged);
        logger.debug("Statistical pass over {} samples: forest({})={}, z-score={}, sudden-change={}, pattern={}",
                samples.size(), scorer.name(), forest, zScores, steps, deviations);
    }

    private int isolationForestPass(List<TelemetrySample> samples, double contamination, Map<Integer, Flags> flagged) {
        int n = samples.size();
        double[] scores = scorer.score(featureMatrix(samples));
        int outlierCount = (int) Math.floor(contamination * n);
        if (outlierCount == 0) {
            return 0;
        }

        // Highest score first; ties keep input order
        List<Integer> ranked = IntStream.range(0, n).boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                        .thenComparingInt(i -> i))
                .collect(Collectors.toList());
        double cutoff = scores[ranked.get(outlierCount)];

        int count = 0;
        for (int rank = 0; rank < outlierCount; rank++) {
            int index = ranked.get(rank);
            double score = scores[index];
            if (score <= cutoff) {
                break;
            }
            Severity severity = score >= HIGH_SCORE ? Severity.HIGH : score >= MEDIUM_SCORE ? Severity.MEDIUM : Severity.LOW;
            markOutlier(samples, index, severity, flagged).outlierScore = score;
            count++;
        }
        return count;
    }

    private int zScorePass(List<TelemetrySample> samples, Map<Integer, Flags> flagged) {
        double threshold = config.getZScoreThreshold();
        int count = 0;
        for (Channel channel : Channel.values()) {
            double mean = SampleWindowing.mean(samples, s -> s.valueOf(channel));
            double std = SampleWindowing.stdDev(samples, s -> s.valueOf(channel));
            if (std < MIN_STD_DEV) {
                continue;
            }
            for (int i = 0; i < samples.size(); i++) {
                double z = Math.abs(samples.get(i).valueOf(channel) - mean) / std;
                if (z > threshold) {
                    markOutlier(samples, i, multipleSeverity(z, threshold), flagged);
                    count++;
                }
            }
        }
        return count;
    }

    private int suddenChangePass(List<TelemetrySample> samples, Map<Integer, Flags> flagged) {
        double threshold = config.getSuddenChangeThreshold();
        int count = 0;
        for (Channel channel : SUDDEN_CHANGE_CHANNELS) {
            for (int i = 1; i < samples.size(); i++) {
                double step = Math.abs(samples.get(i).valueOf(channel) - samples.get(i - 1).valueOf(channel));
                if (step > threshold) {
                    markOutlier(samples, i, multipleSeverity(step, threshold), flagged);
                    count++;
                }
            }
        }
        return count;
    }

    private int patternDeviationPass(List<TelemetrySample> samples, Map<Integer, Flags> flagged) {
        int window = config.getPatternWindow();
        double threshold = config.getZScoreThreshold();
        int count = 0;
        for (Channel channel : PATTERN_CHANNELS) {
            for (int end = window; end <= samples.size(); end++) {
                List<TelemetrySample> trailing = samples.subList(end - window, end);
                double std = SampleWindowing.stdDev(trailing, s -> s.valueOf(channel));
                if (std < MIN_STD_DEV) {
                    continue;
                }
                double mean = SampleWindowing.mean(trailing, s -> s.valueOf(channel));
                int index = end - 1;
                if (Math.abs(samples.get(index).valueOf(channel) - mean) > threshold * std) {
                    markOutlier(samples, index, Severity.MEDIUM, flagged);
                    count++;
                }
            }
        }
        return count;
    }

    private static Flags markOutlier(List<TelemetrySample> samples, int index, Severity severity, Map<Integer, Flags> flagged) {
        TelemetrySample sample = samples.get(index);
        Flags flags = flagged.computeIfAbsent(index, k -> new Flags()).add(AnomalyType.STATISTICAL_OUTLIER, severity);
        for (Channel channel : Channel.values()) {
            flags.values.putIfAbsent(channel.key(), sample.valueOf(channel));
        }
        return flags;
    }

    private static Severity multipleSeverity(double measure, double threshold) {
        return measure >= HIGH_MULTIPLE * threshold ? Severity.HIGH : Severity.MEDIUM;
    }

    /**
     * Feature vector per sample: voltage, current, temperature and their rates
     * of change per second against the previous sample (0 for the first one).
     */
    static double[][] featureMatrix(List<TelemetrySample> samples) {
        double[][] features = new double[samples.size()][6];
        for (int i = 0; i < samples.size(); i++) {
            TelemetrySample sample = samples.get(i);
            double[] row = features[i];
            row[0] = sample.getVoltage();
            row[1] = sample.getCurrent();
            row[2] = sample.getTemperature();
            if (i > 0) {
                TelemetrySample previous = samples.get(i - 1);
                double seconds = (sample.getTimestamp().toEpochMilli() - previous.getTimestamp().toEpochMilli()) / 1000.0;
                if (seconds > 0) {
                    row[3] = (sample.getVoltage() - previous.getVoltage()) / seconds;
                    row[4] = (sample.getCurrent() - previous.getCurrent()) / seconds;
                    row[5] = (sample.getTemperature() - previous.getTemperature()) / seconds;
                }
            }
        }
        return features;
    }

    private static final class Flags {
        private final Set<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
        private final Map<String, Double> values = new LinkedHashMap<>();
        private Double outlierScore;
        private Severity severity;

        Flags add(AnomalyType type, Severity severity) {
            types.add(type);
            this.severity = Severity.max(this.severity, severity);
            return this;
        }
    }
}
