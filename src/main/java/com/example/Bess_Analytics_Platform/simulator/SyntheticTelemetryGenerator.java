package com.example.Bess_Analytics_Platform.simulator;

import com.example.Bess_Analytics_Platform.dto.TelemetryRow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded synthetic cycling telemetry.
 *
 * A battery alternates constant-current discharge and charge between
 * {@link #SOC_LOW} and {@link #SOC_HIGH}; voltage follows SOC linearly and
 * temperature rises with current. Faults overwrite single samples.
 */
public class SyntheticTelemetryGenerator {

    static final double SOC_LOW = 20.0;
    static final double SOC_HIGH = 90.0;

    private final Random random;
    private final double capacityAh;

    public SyntheticTelemetryGenerator(long seed, double capacityAh) {
        this.random = new Random(seed);
        this.capacityAh = capacityAh;
    }

    /**
     * @param start     first sample time
     * @param step      spacing between samples
     * @param count     number of samples
     * @param currentA  magnitude of the cycling current
     * @param startSoc  SOC at the first sample, %
     */
    public List<TelemetryRow> cycling(Instant start, Duration step, int count, double currentA, double startSoc) {
        List<TelemetryRow> rows = new ArrayList<>(count);
        double soc = startSoc;
        double current = currentA; // start discharging
        double hours = step.toMillis() / 3_600_000.0;

        for (int i = 0; i < count; i++) {
            if (soc <= SOC_LOW) {
                current = -currentA;
            } else if (soc >= SOC_HIGH) {
                current = currentA;
            }
            double voltage = 44.0 + 0.1 * soc + random.nextGaussian() * 0.05;
            double temperature = 25.0 + Math.abs(current) * 0.05 + random.nextGaussian() * 0.2;
            double measuredCurrent = current + random.nextGaussian() * 0.1;

            rows.add(TelemetryRow.of(start.plus(step.multipliedBy(i)).toString(),
                    round(voltage), round(measuredCurrent), round(temperature), round(soc)));

            soc -= current * hours / capacityAh * 100.0;
            soc = Math.max(0.0, Math.min(100.0, soc));
        }
        return rows;
    }

    /**
     * Overwrite {@code faults} randomly chosen samples with out-of-range voltage
     * or temperature readings.
     */
    public List<TelemetryRow> withFaults(List<TelemetryRow> rows, int faults) {
        List<TelemetryRow> faulty = new ArrayList<>(rows);
        for (int f = 0; f < faults && !faulty.isEmpty(); f++) {
            int index = random.nextInt(faulty.size());
            TelemetryRow original = faulty.get(index);
            TelemetryRow broken = new TelemetryRow(original.timestamp, original.voltage, original.current,
                    original.temperature, original.soc);
            if (random.nextBoolean()) {
                broken.voltage = String.valueOf(round(65.0 + random.nextDouble() * 5.0));
            } else {
                broken.temperature = String.valueOf(round(55.0 + random.nextDouble() * 10.0));
            }
            faulty.set(index, broken);
        }
        return faulty;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
