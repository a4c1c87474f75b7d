package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.config.EngineConfig;
import com.example.Bess_Analytics_Platform.exception.InsufficientDataException;
import com.example.Bess_Analytics_Platform.model.AnalysisOptions;
import com.example.Bess_Analytics_Platform.model.BatteryRecord;
import com.example.Bess_Analytics_Platform.model.HealthStatus;
import com.example.Bess_Analytics_Platform.model.MetricFlag;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import com.example.Bess_Analytics_Platform.model.TelemetrySample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BatteryMetricsCalculator
 *
 * Rated capacity is 100Ah throughout, samples are one hour apart unless
 * stated otherwise, so 1A over one step moves 1Ah.
 */
class BatteryMetricsCalculatorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    private BatteryMetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new BatteryMetricsCalculator(EngineConfig.defaults());
    }

    @Test
    void testCompute_SingleSampleNoHistory() {
        // Given
        BatteryRecord record = record(sample(0, 50.0, 0.0, 25.0, 75.0));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then
        assertEquals(0.0, snapshot.getDegradationRate(), 0.0001);
        assertTrue(snapshot.hasFlag(MetricFlag.INSUFFICIENT_HISTORY));
        assertTrue(snapshot.hasFlag(MetricFlag.SOH_NOMINAL_ASSUMED));
        assertEquals(100.0, snapshot.getStateOfHealth(), 0.001);
        assertEquals(75.0, snapshot.getStateOfCharge(), 0.001);
        assertEquals(0.0, snapshot.getEquivalentCycles(), 0.0001);
        assertEquals(HealthStatus.GOOD, snapshot.getHealthStatus());
        assertEquals(T0, snapshot.getTimestamp());
    }

    @Test
    void testCompute_EmptyRecord_ThrowsInsufficientData() {
        BatteryRecord empty = new BatteryRecord("battery-001", Collections.emptyList());

        assertThrows(InsufficientDataException.class, () -> calculator.compute(empty));
    }

    @Test
    void testCompute_StrictMode_SingleSampleThrows() {
        BatteryRecord record = record(sample(0, 50.0, 0.0, 25.0, 75.0));
        AnalysisOptions strict = AnalysisOptions.builder().strict(true).build();

        assertThrows(InsufficientDataException.class,
                () -> calculator.compute(record, Collections.emptyList(), strict));
    }

    @Test
    void testCompute_StrictMode_NoSohEvidenceThrows() {
        BatteryRecord record = record(sample(0, 50.0, 5.0, 25.0, null), sample(1, 50.0, 5.0, 25.0, null));
        AnalysisOptions strict = AnalysisOptions.builder().strict(true).build();

        assertThrows(InsufficientDataException.class,
                () -> calculator.compute(record, Collections.emptyList(), strict));
    }

    @Test
    void testCompute_Aggregates() {
        // Given
        BatteryRecord record = record(
                sample(0, 48.0, 10.0, 20.0, null),
                sample(1, 50.0, 20.0, 30.0, null),
                sample(2, 52.0, 30.0, 40.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then
        assertEquals(50.0, snapshot.getAvgVoltage(), 0.001);
        assertEquals(20.0, snapshot.getAvgCurrent(), 0.001);
        assertEquals(30.0, snapshot.getAvgTemperature(), 0.001);
        assertEquals(40.0, snapshot.getMaxTemperature(), 0.001);
        assertEquals(2.0, snapshot.getVoltageStdDev(), 0.001);
        assertEquals(3, snapshot.getSampleCount());
    }

    @Test
    void testCycles_ThroughputOverTwiceRatedCapacity() {
        // Given - 50A for two hours = 100Ah throughput
        BatteryRecord record = record(
                sample(0, 50.0, 50.0, 25.0, null),
                sample(1, 50.0, 50.0, 25.0, null),
                sample(2, 50.0, 50.0, 25.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then
        assertEquals(0.5, snapshot.getEquivalentCycles(), 0.0001);
        assertEquals(0, snapshot.getFullCycles());
    }

    @Test
    void testCycles_ChargeAndDischargeBothCount() {
        // Given - 50Ah discharged then 50Ah charged
        BatteryRecord record = record(
                sample(0, 50.0, 50.0, 25.0, null),
                sample(1, 50.0, 50.0, 25.0, null),
                sample(2, 50.0, -50.0, 25.0, null),
                sample(3, 50.0, -50.0, 25.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then - middle step averages to zero
        assertEquals(0.5, snapshot.getEquivalentCycles(), 0.0001);
    }

    @Test
    void testCycles_OnlyStepsAfterLatestSnapshotCount() {
        // Given - prior snapshot at t=1h with 1.0 cycles; window overlaps it
        MetricsSnapshot prior = snapshot(1, 100.0, 1.0, 50.0);
        BatteryRecord record = record(
                sample(0, 50.0, 50.0, 25.0, null),
                sample(1, 50.0, 50.0, 25.0, null),
                sample(2, 50.0, 50.0, 25.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record, List.of(prior), AnalysisOptions.defaults());

        // Then - only the 1h -> 2h step (50Ah) is new
        assertEquals(1.25, snapshot.getEquivalentCycles(), 0.0001);
    }

    @Test
    void testCycles_ResubmittedWindowDoesNotIncrease() {
        // Given
        BatteryRecord record = record(
                sample(0, 50.0, 50.0, 25.0, null),
                sample(1, 50.0, 50.0, 25.0, null));
        MetricsSnapshot first = calculator.compute(record);

        // When
        MetricsSnapshot second = calculator.compute(record, List.of(first), AnalysisOptions.defaults());

        // Then
        assertEquals(first.getEquivalentCycles(), second.getEquivalentCycles(), 0.0001);
    }

    @Test
    void testCycles_ResetBaseline() {
        // Given
        MetricsSnapshot prior = snapshot(-10, 100.0, 40.0, 50.0);
        BatteryRecord record = record(
                sample(0, 50.0, 50.0, 25.0, null),
                sample(1, 50.0, 50.0, 25.0, null),
                sample(2, 50.0, 50.0, 25.0, null));
        AnalysisOptions options = AnalysisOptions.builder().resetCycleBaseline(10.0).build();

        // When
        MetricsSnapshot snapshot = calculator.compute(record, List.of(prior), options);

        // Then
        assertEquals(10.5, snapshot.getEquivalentCycles(), 0.0001);
        assertTrue(snapshot.hasFlag(MetricFlag.CYCLE_BASELINE_RESET));
    }

    @Test
    void testSoh_FromReportedCapacity() {
        // Given
        BatteryRecord record = record(
                new TelemetrySample(T0, 50.0, 0.0, 25.0, 60.0, 90.0),
                new TelemetrySample(T0.plus(HOUR), 50.0, 0.0, 25.0, 60.0, 85.0));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then - latest capacity wins
        assertEquals(85.0, snapshot.getStateOfHealth(), 0.001);
        assertTrue(snapshot.hasFlag(MetricFlag.SOH_FROM_REPORTED_CAPACITY));
        assertEquals(HealthStatus.WARNING, snapshot.getHealthStatus());
    }

    @Test
    void testSoh_EstimatedFromDischargeRun() {
        // Given - 40Ah moved SOC from 90% to 40%: capacity 80Ah
        BatteryRecord record = record(
                sample(0, 50.0, 40.0, 25.0, 90.0),
                sample(1, 50.0, 40.0, 25.0, 40.0));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then
        assertEquals(80.0, snapshot.getStateOfHealth(), 0.01);
        assertFalse(snapshot.hasFlag(MetricFlag.SOH_NOMINAL_ASSUMED));
        assertEquals(HealthStatus.WARNING, snapshot.getHealthStatus());
    }

    @Test
    void testSoh_SmallSwingIgnored_CarriedForward() {
        // Given - a 5 point swing is below the 20 point minimum
        MetricsSnapshot prior = snapshot(-24, 92.0, 3.0, 60.0);
        BatteryRecord record = record(
                sample(0, 50.0, 5.0, 25.0, 90.0),
                sample(1, 50.0, 5.0, 25.0, 85.0));

        // When
        MetricsSnapshot snapshot = calculator.compute(record, List.of(prior), AnalysisOptions.defaults());

        // Then
        assertEquals(92.0, snapshot.getStateOfHealth(), 0.001);
        assertTrue(snapshot.hasFlag(MetricFlag.SOH_CARRIED_FORWARD));
    }

    @Test
    void testSoc_CoulombCountedFromLastReportedSample() {
        // Given - 10Ah discharged after the last SOC reading of 80%
        BatteryRecord record = record(
                sample(0, 50.0, 10.0, 25.0, 80.0),
                sample(1, 50.0, 10.0, 25.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then
        assertEquals(70.0, snapshot.getStateOfCharge(), 0.001);
        assertTrue(snapshot.hasFlag(MetricFlag.SOC_COULOMB_COUNTED));
    }

    @Test
    void testSoc_CoulombCountedFromPriorSnapshot() {
        // Given - prior snapshot at t0 with 50% SOC, then 20Ah charged
        MetricsSnapshot prior = snapshot(0, 100.0, 0.0, 50.0);
        BatteryRecord record = record(
                sample(0, 50.0, -20.0, 25.0, null),
                sample(1, 50.0, -20.0, 25.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record, List.of(prior), AnalysisOptions.defaults());

        // Then
        assertEquals(70.0, snapshot.getStateOfCharge(), 0.001);
        assertTrue(snapshot.hasFlag(MetricFlag.SOC_COULOMB_COUNTED));
    }

    @Test
    void testSoc_UnavailableWithoutBaseline() {
        // Given
        BatteryRecord record = record(
                sample(0, 50.0, 10.0, 25.0, null),
                sample(1, 50.0, 10.0, 25.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then
        assertNull(snapshot.getStateOfCharge());
        assertTrue(snapshot.hasFlag(MetricFlag.SOC_UNAVAILABLE));
    }

    @Test
    void testDegradation_LinearFitOverHistory() {
        // Given - SOH 100 -> 99 -> 98 at day 0, 10, 20
        MetricsSnapshot day0 = snapshot(0, 100.0, 0.0, 50.0);
        MetricsSnapshot day10 = snapshot(240, 99.0, 10.0, 50.0);
        BatteryRecord record = record(new TelemetrySample(T0.plus(Duration.ofDays(20)), 50.0, 0.0, 25.0, 50.0, 98.0));

        // When
        MetricsSnapshot snapshot = calculator.compute(record, Arrays.asList(day0, day10), AnalysisOptions.defaults());

        // Then - 0.1%/day is 3% per 30 days
        assertEquals(3.0, snapshot.getDegradationRate(), 0.001);
        assertEquals(0.15, snapshot.getDegradationPerCycle(), 0.001);
        assertFalse(snapshot.hasFlag(MetricFlag.INSUFFICIENT_HISTORY));
    }

    @Test
    void testDegradation_ImprovingSohReportsZero() {
        // Given
        MetricsSnapshot prior = snapshot(0, 90.0, 0.0, 50.0);
        BatteryRecord record = record(new TelemetrySample(T0.plus(Duration.ofDays(5)), 50.0, 0.0, 25.0, 50.0, 95.0));

        // When
        MetricsSnapshot snapshot = calculator.compute(record, List.of(prior), AnalysisOptions.defaults());

        // Then
        assertEquals(0.0, snapshot.getDegradationRate(), 0.0001);
    }

    @Test
    void testEnergyEfficiency_DischargedOverCharged() {
        // Given - charge at 50V, discharge at 45V, 10A each way
        BatteryRecord record = record(
                sample(0, 50.0, -10.0, 25.0, null),
                sample(1, 50.0, -10.0, 25.0, null),
                sample(2, 45.0, 10.0, 25.0, null),
                sample(3, 45.0, 10.0, 25.0, null));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then - 450Wh out / (500 + 25)Wh in
        assertEquals(450.0 / 525.0 * 100.0, snapshot.getEnergyEfficiency(), 0.01);
    }

    @Test
    void testEnergyEfficiency_NullWithoutCharging() {
        BatteryRecord record = record(sample(0, 50.0, 10.0, 25.0, null), sample(1, 50.0, 10.0, 25.0, null));

        assertNull(calculator.compute(record).getEnergyEfficiency());
    }

    @Test
    void testClassifyHealth_Boundaries() {
        assertEquals(HealthStatus.GOOD, calculator.classifyHealth(95.0));
        assertEquals(HealthStatus.GOOD, calculator.classifyHealth(90.0));
        assertEquals(HealthStatus.WARNING, calculator.classifyHealth(89.9));
        assertEquals(HealthStatus.WARNING, calculator.classifyHealth(70.0));
        assertEquals(HealthStatus.CRITICAL, calculator.classifyHealth(69.9));
    }

    @Test
    void testClassifyHealth_ConfiguredThresholds() {
        // Given
        BatteryMetricsCalculator strictFleet = new BatteryMetricsCalculator(
                EngineConfig.builder().goodThreshold(95.0).warningThreshold(85.0).build());

        // Then
        assertEquals(HealthStatus.WARNING, strictFleet.classifyHealth(92.0));
        assertEquals(HealthStatus.CRITICAL, strictFleet.classifyHealth(80.0));
    }

    @Test
    void testPercentagesAreClamped() {
        // Given - measured capacity above rating
        BatteryRecord record = record(new TelemetrySample(T0, 50.0, 0.0, 25.0, 50.0, 120.0));

        // When
        MetricsSnapshot snapshot = calculator.compute(record);

        // Then
        assertEquals(100.0, snapshot.getStateOfHealth(), 0.001);
    }

    private static TelemetrySample sample(int hour, double voltage, double current, double temperature, Double soc) {
        return new TelemetrySample(T0.plus(HOUR.multipliedBy(hour)), voltage, current, temperature, soc);
    }

    private static BatteryRecord record(TelemetrySample... samples) {
        return new BatteryRecord("battery-001", Arrays.asList(samples));
    }

    private static MetricsSnapshot snapshot(int hour, double soh, double cycles, Double soc) {
        return MetricsSnapshot.builder()
                .batteryId("battery-001")
                .timestamp(T0.plus(HOUR.multipliedBy(hour)))
                .stateOfHealth(soh)
                .stateOfCharge(soc)
                .equivalentCycles(cycles)
                .healthStatus(HealthStatus.GOOD)
                .build();
    }
}
