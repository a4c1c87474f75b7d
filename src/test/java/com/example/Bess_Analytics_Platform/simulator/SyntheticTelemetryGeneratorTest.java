package com.example.Bess_Analytics_Platform.simulator;

import com.example.Bess_Analytics_Platform.dto.TelemetryRow;
import com.example.Bess_Analytics_Platform.model.NormalizationResult;
import com.example.Bess_Analytics_Platform.service.SampleWindowing;
import com.example.Bess_Analytics_Platform.service.TelemetryNormalizer;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticTelemetryGeneratorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testCycling_RowsNormalizeCleanly() {
        // Given
        SyntheticTelemetryGenerator generator = new SyntheticTelemetryGenerator(42L, 100.0);

        // When
        List<TelemetryRow> rows = generator.cycling(T0, Duration.ofMinutes(1), 120, 50.0, 85.0);
        NormalizationResult result = new TelemetryNormalizer(new SampleWindowing()).normalize("sim", rows);

        // Then
        assertEquals(120, result.getAcceptedCount());
        assertEquals(0, result.getRejectedCount());
        assertEquals(T0, result.getRecord().first().getTimestamp());
    }

    @Test
    void testCycling_SameSeedSameData() {
        List<TelemetryRow> first = new SyntheticTelemetryGenerator(7L, 100.0)
                .cycling(T0, Duration.ofMinutes(1), 10, 20.0, 50.0);
        List<TelemetryRow> second = new SyntheticTelemetryGenerator(7L, 100.0)
                .cycling(T0, Duration.ofMinutes(1), 10, 20.0, 50.0);

        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).voltage, second.get(i).voltage);
            assertEquals(first.get(i).temperature, second.get(i).temperature);
        }
    }

    @Test
    void testWithFaults_LeavesInputUntouched() {
        // Given
        SyntheticTelemetryGenerator generator = new SyntheticTelemetryGenerator(3L, 100.0);
        List<TelemetryRow> rows = generator.cycling(T0, Duration.ofMinutes(1), 30, 20.0, 50.0);
        String originalVoltage = rows.get(0).voltage;

        // When
        List<TelemetryRow> faulty = generator.withFaults(rows, 30);

        // Then
        assertEquals(rows.size(), faulty.size());
        assertEquals(originalVoltage, rows.get(0).voltage);
        long outOfBand = faulty.stream()
                .filter(r -> Double.parseDouble(r.voltage) > 60.0 || Double.parseDouble(r.temperature) > 50.0)
                .count();
        assertTrue(outOfBand > 0);
    }
}
