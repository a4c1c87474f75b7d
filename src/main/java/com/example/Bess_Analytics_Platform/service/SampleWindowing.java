package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.exception.ConfigurationException;
import com.example.Bess_Analytics_Platform.model.PeriodSummary;
import com.example.Bess_Analytics_Platform.model.TelemetrySample;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Fixed-interval windowing over timestamp-ordered samples.
 *
 * Buckets are aligned to the epoch: a sample at t falls in the bucket starting
 * at floor(t / interval) * interval. Empty buckets produce no output.
 */
@Service
public class SampleWindowing {

    /**
     * Mean-aggregate samples per bucket. Optional channels are averaged over
     * the samples that report them and stay null if none do.
     */
    public List<TelemetrySample> resample(List<TelemetrySample> samples, Duration interval) {
        List<TelemetrySample> resampled = new ArrayList<>();
        for (Bucket bucket : buckets(samples, interval)) {
            List<TelemetrySample> members = bucket.samples;
            resampled.add(new TelemetrySample(
                    bucket.start,
                    mean(members, TelemetrySample::getVoltage),
                    mean(members, TelemetrySample::getCurrent),
                    mean(members, TelemetrySample::getTemperature),
                    meanOfPresent(members, true),
                    meanOfPresent(members, false)));
        }
        return resampled;
    }

    /**
     * Per-period mean/min/max/std statistics for every channel.
     */
    public List<PeriodSummary> aggregate(List<TelemetrySample> samples, Duration period) {
        List<PeriodSummary> summaries = new ArrayList<>();
        for (Bucket bucket : buckets(samples, period)) {
            List<TelemetrySample> members = bucket.samples;
            List<TelemetrySample> withSoc = new ArrayList<>();
            for (TelemetrySample sample : members) {
                if (sample.hasSoc()) {
                    withSoc.add(sample);
                }
            }
            summaries.add(new PeriodSummary(
                    bucket.start,
                    members.size(),
                    stats(members, TelemetrySample::getVoltage),
                    stats(members, TelemetrySample::getCurrent),
                    stats(members, TelemetrySample::getTemperature),
                    withSoc.isEmpty() ? null : stats(withSoc, TelemetrySample::getSocReported)));
        }
        return summaries;
    }

    private List<Bucket> buckets(List<TelemetrySample> samples, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new ConfigurationException("Window interval must be positive, got " + interval);
        }
        long intervalMillis = interval.toMillis();
        if (intervalMillis <= 0) {
            throw new ConfigurationException("Window interval must be at least 1ms, got " + interval);
        }

        List<Bucket> buckets = new ArrayList<>();
        Bucket current = null;
        for (TelemetrySample sample : samples) {
            long start = Math.floorDiv(sample.getTimestamp().toEpochMilli(), intervalMillis) * intervalMillis;
            if (current == null || current.startMillis != start) {
                current = new Bucket(start);
                buckets.add(current);
            }
            current.samples.add(sample);
        }
        return buckets;
    }

    static double mean(List<TelemetrySample> samples, ToDoubleFunction<TelemetrySample> channel) {
        double sum = 0.0;
        for (TelemetrySample sample : samples) {
            sum += channel.applyAsDouble(sample);
        }
        return samples.isEmpty() ? 0.0 : sum / samples.size();
    }

    /**
     * Sample standard deviation (n - 1); 0 for fewer than two samples.
     */
    static double stdDev(List<TelemetrySample> samples, ToDoubleFunction<TelemetrySample> channel) {
        if (samples.size() < 2) {
            return 0.0;
        }
        double mean = mean(samples, channel);
        double sumSquares = 0.0;
        for (TelemetrySample sample : samples) {
            double deviation = channel.applyAsDouble(sample) - mean;
            sumSquares += deviation * deviation;
        }
        return Math.sqrt(sumSquares / (samples.size() - 1));
    }

    private static PeriodSummary.ChannelStats stats(List<TelemetrySample> samples, ToDoubleFunction<TelemetrySample> channel) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (TelemetrySample sample : samples) {
            double value = channel.applyAsDouble(sample);
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return new PeriodSummary.ChannelStats(mean(samples, channel), min, max, stdDev(samples, channel));
    }

    private static Double meanOfPresent(List<TelemetrySample> samples, boolean soc) {
        double sum = 0.0;
        int count = 0;
        for (TelemetrySample sample : samples) {
            Double value = soc ? sample.getSocReported() : sample.getCapacityReported();
            if (value != null) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    private static final class Bucket {
        private final long startMillis;
        private final Instant start;
        private final List<TelemetrySample> samples = new ArrayList<>();

        private Bucket(long startMillis) {
            this.startMillis = startMillis;
            this.start = Instant.ofEpochMilli(startMillis);
        }
    }
}
