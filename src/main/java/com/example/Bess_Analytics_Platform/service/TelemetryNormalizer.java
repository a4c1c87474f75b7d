package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.dto.TelemetryRow;
import com.example.Bess_Analytics_Platform.model.BatteryRecord;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import com.example.Bess_Analytics_Platform.model.NormalizationResult;
import com.example.Bess_Analytics_Platform.model.TelemetrySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Turns raw telemetry rows into a clean, timestamp-ordered {@link BatteryRecord}.
 *
 * Policy:
 * - rows missing timestamp, voltage, current or temperature are dropped and counted
 * - rows whose numeric fields (optional soc/capacity included) do not parse to a
 *   finite number are dropped and counted
 * - samples are sorted by timestamp; repeated timestamps keep the row seen last
 * - reported SOC is clamped to [0, 100]
 * - resampling (mean per fixed bucket) only when an interval is requested
 * - all-digit timestamps are epoch seconds below 10^11 and epoch milliseconds
 *   from there on (10^11 ms is March 1973)
 */
@Service
public class TelemetryNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryNormalizer.class);

    private static final long EPOCH_MILLIS_FROM = 100_000_000_000L;

    private final SampleWindowing windowing;

    public TelemetryNormalizer(SampleWindowing windowing) {
        this.windowing = windowing;
    }

    public NormalizationResult normalize(String batteryId, List<TelemetryRow> rows) {
        return normalize(batteryId, rows, null);
    }

    /**
     * @param resampleInterval bucket length for mean resampling, or null to keep native resolution
     */
    public NormalizationResult normalize(String batteryId, List<TelemetryRow> rows, Duration resampleInterval) {
        List<TelemetrySample> parsed = new ArrayList<>();
        int rejected = 0;
        int inputCount = rows != null ? rows.size() : 0;

        if (rows != null) {
            for (TelemetryRow row : rows) {
                TelemetrySample sample = toSample(row);
                if (sample == null) {
                    rejected++;
                } else {
                    parsed.add(sample);
                }
            }
        }

        NormalizationResult result = order(batteryId, parsed, inputCount, rejected, resampleInterval);
        if (result.getRejectedCount() > 0 || result.getDuplicateCount() > 0) {
            logger.info("Normalized telemetry for {}: {} rows in, {} rejected, {} duplicate timestamps, {} samples out",
                    batteryId, inputCount, result.getRejectedCount(), result.getDuplicateCount(), result.getRecord().size());
        } else {
            logger.debug("Normalized telemetry: {}", result);
        }
        return result;
    }

    /**
     * Re-apply ordering and de-duplication to an existing record. A record
     * that is already normalized comes back unchanged.
     */
    public BatteryRecord renormalize(BatteryRecord record) {
        return order(record.getBatteryId(), record.getSamples(), record.size(), 0, null).getRecord();
    }

    private NormalizationResult order(String batteryId, List<TelemetrySample> samples, int inputCount,
                                      int rejected, Duration resampleInterval) {
        // TreeMap keyed by timestamp: sorts, and a later put replaces an earlier one (last write wins)
        Map<Instant, TelemetrySample> byTimestamp = new TreeMap<>();
        int duplicates = 0;
        for (TelemetrySample sample : samples) {
            if (byTimestamp.put(sample.getTimestamp(), sample) != null) {
                duplicates++;
            }
        }

        List<TelemetrySample> ordered = new ArrayList<>(byTimestamp.values());
        boolean resampled = false;
        if (resampleInterval != null) {
            ordered = windowing.resample(ordered, resampleInterval);
            resampled = true;
        }
        return new NormalizationResult(new BatteryRecord(batteryId, ordered), inputCount, rejected, duplicates, resampled);
    }

    private TelemetrySample toSample(TelemetryRow row) {
        if (row == null) {
            return null;
        }
        Instant timestamp = parseTimestamp(row.timestamp);
        Double voltage = parseNumber(row.voltage);
        Double current = parseNumber(row.current);
        Double temperature = parseNumber(row.temperature);
        if (timestamp == null || voltage == null || current == null || temperature == null) {
            logger.debug("Dropping telemetry row with missing or malformed mandatory field: {}", row);
            return null;
        }

        Double soc = null;
        if (isPresent(row.soc)) {
            soc = parseNumber(row.soc);
            if (soc == null) {
                logger.debug("Dropping telemetry row with malformed soc: {}", row);
                return null;
            }
            soc = MetricsSnapshot.clampPercent(soc);
        }

        Double capacity = null;
        if (isPresent(row.capacity)) {
            capacity = parseNumber(row.capacity);
            if (capacity == null || capacity < 0) {
                logger.debug("Dropping telemetry row with malformed capacity: {}", row);
                return null;
            }
        }

        return new TelemetrySample(timestamp, voltage, current, temperature, soc, capacity);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    static Double parseNumber(String value) {
        if (!isPresent(value)) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Accepts ISO-8601 instants and offsets, ISO local date-times (read as
     * UTC, 'T' or space separated), ISO dates, and epoch seconds or
     * milliseconds told apart by magnitude.
     */
    static Instant parseTimestamp(String value) {
        if (!isPresent(value)) {
            return null;
        }
        String text = value.trim();
        if (text.matches("-?\\d{9,}")) {
            try {
                long epoch = Long.parseLong(text);
                return Math.abs(epoch) < EPOCH_MILLIS_FROM ? Instant.ofEpochSecond(epoch) : Instant.ofEpochMilli(epoch);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        Instant parsed = tryParse(() -> OffsetDateTime.parse(text).toInstant());
        if (parsed == null) {
            parsed = tryParse(() -> LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = tryParse(() -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        return parsed;
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
