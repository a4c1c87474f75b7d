package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.config.EngineConfig;
import com.example.Bess_Analytics_Platform.exception.InsufficientDataException;
import com.example.Bess_Analytics_Platform.model.AnalysisOptions;
import com.example.Bess_Analytics_Platform.model.BatteryRecord;
import com.example.Bess_Analytics_Platform.model.HealthStatus;
import com.example.Bess_Analytics_Platform.model.MetricFlag;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import com.example.Bess_Analytics_Platform.model.TelemetrySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Battery health metrics: SOH, SOC, equivalent cycles, degradation rate.
 *
 * Sign convention: positive current is discharge, negative is charge.
 * Charge moved per step is integrated with the trapezoidal rule in Ah.
 *
 * SOH evidence, strongest first:
 * - measured capacity reported by the BMS
 * - capacity estimated from charge/discharge runs with reported SOC at both
 *   ends and a swing of at least {@code minSocSwing} points
 * - the previous snapshot's SOH
 * - 100% nominal (flagged)
 *
 * Cycle counting only integrates steps that start at or after the latest
 * stored snapshot, so an overlapping window is never counted twice.
 */
@Service
public class BatteryMetricsCalculator {

    private static final Logger logger = LoggerFactory.getLogger(BatteryMetricsCalculator.class);

    private static final double SECONDS_PER_HOUR = 3600.0;
    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double DEGRADATION_WINDOW_DAYS = 30.0;

    private final EngineConfig config;

    public BatteryMetricsCalculator(EngineConfig config) {
        this.config = config;
    }

    public MetricsSnapshot compute(BatteryRecord record) {
        return compute(record, Collections.emptyList(), AnalysisOptions.defaults());
    }

    /**
     * @param history stored snapshots for the battery, oldest first; may be empty
     * @throws InsufficientDataException on an empty record, or in strict mode when
     *                                   the record has a single sample or no SOH evidence
     */
    public MetricsSnapshot compute(BatteryRecord record, List<MetricsSnapshot> history, AnalysisOptions options) {
        if (record.isEmpty()) {
            throw new InsufficientDataException("No valid telemetry samples for battery " + record.getBatteryId());
        }
        if (options.isStrict() && record.size() < 2) {
            throw new InsufficientDataException("At least two samples are required for battery "
                    + record.getBatteryId() + " in strict mode");
        }

        List<TelemetrySample> samples = record.getSamples();
        MetricsSnapshot prior = history.isEmpty() ? null : history.get(history.size() - 1);
        MetricsSnapshot.Builder builder = MetricsSnapshot.builder()
                .batteryId(record.getBatteryId())
                .timestamp(record.last().getTimestamp())
                .sampleCount(samples.size());

        builder.avgVoltage(SampleWindowing.mean(samples, TelemetrySample::getVoltage))
                .avgCurrent(SampleWindowing.mean(samples, TelemetrySample::getCurrent))
                .avgTemperature(SampleWindowing.mean(samples, TelemetrySample::getTemperature))
                .maxTemperature(samples.stream().mapToDouble(TelemetrySample::getTemperature).max().orElse(0.0))
                .voltageStdDev(SampleWindowing.stdDev(samples, TelemetrySample::getVoltage))
                .energyEfficiency(energyEfficiency(samples));

        double soh = stateOfHealth(samples, prior, options, builder);
        builder.stateOfHealth(soh);
        builder.stateOfCharge(stateOfCharge(samples, prior, soh, builder));

        double cycles = equivalentCycles(samples, prior, options, builder);
        builder.equivalentCycles(cycles);

        degradation(history, record.last().getTimestamp(), MetricsSnapshot.clampPercent(soh), cycles, builder);
        builder.healthStatus(classifyHealth(soh));

        MetricsSnapshot snapshot = builder.build();
        logger.debug("Computed metrics for {}: {}", record.getBatteryId(), snapshot);
        return snapshot;
    }

    public HealthStatus classifyHealth(double stateOfHealth) {
        if (stateOfHealth >= config.getGoodThreshold()) {
            return HealthStatus.GOOD;
        }
        if (stateOfHealth >= config.getWarningThreshold()) {
            return HealthStatus.WARNING;
        }
        return HealthStatus.CRITICAL;
    }

    private double stateOfHealth(List<TelemetrySample> samples, MetricsSnapshot prior,
                                 AnalysisOptions options, MetricsSnapshot.Builder builder) {
        double rated = config.getRatedCapacityAh();

        for (int i = samples.size() - 1; i >= 0; i--) {
            if (samples.get(i).hasCapacity()) {
                builder.flag(MetricFlag.SOH_FROM_REPORTED_CAPACITY);
                return samples.get(i).getCapacityReported() / rated * 100.0;
            }
        }

        Double estimated = estimateCapacity(samples);
        if (estimated != null) {
            return estimated / rated * 100.0;
        }

        if (prior != null) {
            builder.flag(MetricFlag.SOH_CARRIED_FORWARD);
            return prior.getStateOfHealth();
        }

        if (options.isStrict()) {
            throw new InsufficientDataException("No capacity evidence to estimate state of health");
        }
        builder.flag(MetricFlag.SOH_NOMINAL_ASSUMED);
        return 100.0;
    }

    /**
     * Capacity in Ah from runs of same-direction current, or null when no run
     * carries enough SOC swing.
     */
    Double estimateCapacity(List<TelemetrySample> samples) {
        double totalAh = 0.0;
        double totalSwing = 0.0;

        int runStart = 0;
        int runDirection = 0;
        for (int i = 1; i <= samples.size(); i++) {
            int direction = i < samples.size() ? (int) Math.signum(chargeAh(samples.get(i - 1), samples.get(i))) : 0;
            if (direction == runDirection && direction != 0) {
                continue;
            }
            if (runDirection != 0) {
                double[] run = runContribution(samples, runStart, i - 1);
                if (run != null && run[1] >= config.getMinSocSwing()) {
                    totalAh += run[0];
                    totalSwing += run[1];
                }
            }
            runStart = i - 1;
            runDirection = direction;
        }

        if (totalSwing <= 0.0) {
            return null;
        }
        double capacity = totalAh / (totalSwing / 100.0);
        logger.debug("Estimated capacity {}Ah from {}Ah over {}% SOC swing",
                String.format("%.2f", capacity), String.format("%.2f", totalAh), String.format("%.1f", totalSwing));
        return capacity;
    }

    // {|Ah|, |dSOC|} between the first and last samples of the run that report SOC
    private static double[] runContribution(List<TelemetrySample> samples, int from, int to) {
        int first = -1;
        int last = -1;
        for (int i = from; i <= to; i++) {
            if (samples.get(i).hasSoc()) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        if (first < 0 || first == last) {
            return null;
        }
        double ah = 0.0;
        for (int i = first + 1; i <= last; i++) {
            ah += chargeAh(samples.get(i - 1), samples.get(i));
        }
        double swing = Math.abs(samples.get(last).getSocReported() - samples.get(first).getSocReported());
        return new double[] {Math.abs(ah), swing};
    }

    private Double stateOfCharge(List<TelemetrySample> samples, MetricsSnapshot prior, double soh,
                                 MetricsSnapshot.Builder builder) {
        TelemetrySample latest = samples.get(samples.size() - 1);
        if (latest.hasSoc()) {
            return latest.getSocReported();
        }

        double usableAh = config.getRatedCapacityAh() * MetricsSnapshot.clampPercent(soh) / 100.0;
        int anchor = -1;
        for (int i = samples.size() - 1; i >= 0; i--) {
            if (samples.get(i).hasSoc()) {
                anchor = i;
                break;
            }
        }

        if (usableAh > 0.0) {
            if (anchor >= 0) {
                double net = 0.0;
                for (int i = anchor + 1; i < samples.size(); i++) {
                    net += chargeAh(samples.get(i - 1), samples.get(i));
                }
                builder.flag(MetricFlag.SOC_COULOMB_COUNTED);
                return samples.get(anchor).getSocReported() - net / usableAh * 100.0;
            }
            if (prior != null && prior.getStateOfCharge() != null) {
                double net = netChargeSince(samples, prior.getTimestamp());
                builder.flag(MetricFlag.SOC_COULOMB_COUNTED);
                return prior.getStateOfCharge() - net / usableAh * 100.0;
            }
        }

        if (anchor >= 0) {
            builder.flag(MetricFlag.SOC_AVERAGED);
            return samples.stream().filter(TelemetrySample::hasSoc)
                    .mapToDouble(TelemetrySample::getSocReported).average().orElse(0.0);
        }

        builder.flag(MetricFlag.SOC_UNAVAILABLE);
        return null;
    }

    private double equivalentCycles(List<TelemetrySample> samples, MetricsSnapshot prior,
                                    AnalysisOptions options, MetricsSnapshot.Builder builder) {
        double baseline;
        Instant since;
        if (options.isResetCycleBaseline()) {
            builder.flag(MetricFlag.CYCLE_BASELINE_RESET);
            baseline = Math.max(0.0, options.getCycleBaseline());
            since = null;
        } else if (prior != null) {
            baseline = prior.getEquivalentCycles();
            since = prior.getTimestamp();
        } else {
            baseline = 0.0;
            since = null;
        }

        double throughput = 0.0;
        for (int i = 1; i < samples.size(); i++) {
            if (since != null && samples.get(i - 1).getTimestamp().isBefore(since)) {
                continue;
            }
            throughput += Math.abs(chargeAh(samples.get(i - 1), samples.get(i)));
        }

        double cycles = baseline + throughput / (2.0 * config.getRatedCapacityAh());
        logger.debug("Cycle count: baseline={}, throughput={}Ah, cycles={}",
                baseline, String.format("%.3f", throughput), String.format("%.4f", cycles));
        return cycles;
    }

    private void degradation(List<MetricsSnapshot> history, Instant now, double soh, double cycles,
                             MetricsSnapshot.Builder builder) {
        List<double[]> points = new ArrayList<>(history.size() + 1);
        for (MetricsSnapshot snapshot : history) {
            points.add(new double[] {epochDays(snapshot.getTimestamp()), snapshot.getEquivalentCycles(), snapshot.getStateOfHealth()});
        }
        points.add(new double[] {epochDays(now), cycles, soh});

        Double perDay = slope(points, 0);
        if (perDay == null) {
            builder.flag(MetricFlag.INSUFFICIENT_HISTORY);
            builder.degradationRate(0.0).degradationPerCycle(0.0);
            return;
        }
        builder.degradationRate(Math.max(0.0, -perDay * DEGRADATION_WINDOW_DAYS));

        Double perCycle = slope(points, 1);
        builder.degradationPerCycle(perCycle != null ? Math.max(0.0, -perCycle) : 0.0);
    }

    /**
     * Least-squares slope of SOH (column 2) against the given column, or null
     * when the x values have no spread.
     */
    static Double slope(List<double[]> points, int xColumn) {
        int n = points.size();
        if (n < 2) {
            return null;
        }
        double meanX = 0.0;
        double meanY = 0.0;
        for (double[] p : points) {
            meanX += p[xColumn];
            meanY += p[2];
        }
        meanX /= n;
        meanY /= n;

        double sxx = 0.0;
        double sxy = 0.0;
        for (double[] p : points) {
            double dx = p[xColumn] - meanX;
            sxx += dx * dx;
            sxy += dx * (p[2] - meanY);
        }
        if (sxx <= 1e-12) {
            return null;
        }
        return sxy / sxx;
    }

    private static Double energyEfficiency(List<TelemetrySample> samples) {
        double dischargedWh = 0.0;
        double chargedWh = 0.0;
        for (int i = 1; i < samples.size(); i++) {
            TelemetrySample previous = samples.get(i - 1);
            TelemetrySample current = samples.get(i);
            double wh = (previous.power() + current.power()) / 2.0 * hoursBetween(previous, current);
            if (wh > 0) {
                dischargedWh += wh;
            } else {
                chargedWh -= wh;
            }
        }
        return chargedWh > 0.0 ? dischargedWh / chargedWh * 100.0 : null;
    }

    private static double netChargeSince(List<TelemetrySample> samples, Instant since) {
        double net = 0.0;
        for (int i = 1; i < samples.size(); i++) {
            if (!samples.get(i - 1).getTimestamp().isBefore(since)) {
                net += chargeAh(samples.get(i - 1), samples.get(i));
            }
        }
        return net;
    }

    /** Signed Ah between two samples, positive when discharging. */
    static double chargeAh(TelemetrySample previous, TelemetrySample current) {
        return (previous.getCurrent() + current.getCurrent()) / 2.0 * hoursBetween(previous, current);
    }

    private static double hoursBetween(TelemetrySample previous, TelemetrySample current) {
        return (current.getTimestamp().toEpochMilli() - previous.getTimestamp().toEpochMilli()) / 1000.0 / SECONDS_PER_HOUR;
    }

    private static double epochDays(Instant instant) {
        return instant.toEpochMilli() / 1000.0 / SECONDS_PER_DAY;
    }
}
