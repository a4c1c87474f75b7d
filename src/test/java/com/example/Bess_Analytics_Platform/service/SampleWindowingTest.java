package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.exception.ConfigurationException;
import com.example.Bess_Analytics_Platform.model.PeriodSummary;
import com.example.Bess_Analytics_Platform.model.TelemetrySample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleWindowingTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private SampleWindowing windowing;

    @BeforeEach
    void setUp() {
        windowing = new SampleWindowing();
    }

    @Test
    void testResample_AveragesOptionalChannelsOverPresentValues() {
        // Given
        List<TelemetrySample> samples = Arrays.asList(
                new TelemetrySample(T0, 48.0, 10.0, 25.0, 80.0),
                new TelemetrySample(T0.plusSeconds(20), 50.0, 10.0, 25.0, null),
                new TelemetrySample(T0.plusSeconds(40), 52.0, 10.0, 25.0, 70.0));

        // When
        List<TelemetrySample> resampled = windowing.resample(samples, Duration.ofMinutes(1));

        // Then
        assertEquals(1, resampled.size());
        assertEquals(50.0, resampled.get(0).getVoltage(), 0.001);
        assertEquals(75.0, resampled.get(0).getSocReported(), 0.001);
        assertNull(resampled.get(0).getCapacityReported());
        assertEquals(T0, resampled.get(0).getTimestamp());
    }

    @Test
    void testAggregate_PerPeriodStatistics() {
        // Given - two hours, two samples each
        List<TelemetrySample> samples = Arrays.asList(
                new TelemetrySample(T0, 48.0, 10.0, 20.0, null),
                new TelemetrySample(T0.plusSeconds(1800), 52.0, 30.0, 30.0, null),
                new TelemetrySample(T0.plusSeconds(3600), 50.0, -10.0, 25.0, 60.0),
                new TelemetrySample(T0.plusSeconds(5400), 50.0, -10.0, 25.0, 62.0));

        // When
        List<PeriodSummary> summaries = windowing.aggregate(samples, Duration.ofHours(1));

        // Then
        assertEquals(2, summaries.size());
        PeriodSummary first = summaries.get(0);
        assertEquals(2, first.getSampleCount());
        assertEquals(50.0, first.getVoltage().getMean(), 0.001);
        assertEquals(48.0, first.getVoltage().getMin(), 0.001);
        assertEquals(52.0, first.getVoltage().getMax(), 0.001);
        assertEquals(Math.sqrt(8.0), first.getVoltage().getStdDev(), 0.001);
        assertNull(first.getSoc());

        PeriodSummary second = summaries.get(1);
        assertEquals(T0.plusSeconds(3600), second.getPeriodStart());
        assertEquals(0.0, second.getVoltage().getStdDev(), 0.001);
        assertEquals(61.0, second.getSoc().getMean(), 0.001);
    }

    @Test
    void testAggregate_NonPositivePeriod_ThrowsConfigurationException() {
        List<TelemetrySample> samples = List.of(new TelemetrySample(T0, 48.0, 0.0, 25.0, null));

        assertThrows(ConfigurationException.class, () -> windowing.aggregate(samples, Duration.ZERO));
        assertThrows(ConfigurationException.class, () -> windowing.resample(samples, Duration.ofSeconds(-5)));
    }

    @Test
    void testStdDev_SingleSampleIsZero() {
        List<TelemetrySample> samples = List.of(new TelemetrySample(T0, 48.0, 0.0, 25.0, null));

        assertEquals(0.0, SampleWindowing.stdDev(samples, TelemetrySample::getVoltage), 0.0001);
        assertEquals(48.0, SampleWindowing.mean(samples, TelemetrySample::getVoltage), 0.0001);
    }
}
