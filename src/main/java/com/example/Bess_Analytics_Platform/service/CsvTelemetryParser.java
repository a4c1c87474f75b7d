package com.example.Bess_Analytics_Platform.service;

import com.example.Bess_Analytics_Platform.dto.TelemetryRow;
import com.example.Bess_Analytics_Platform.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses telemetry CSV uploads into raw rows.
 *
 * Format: a header line naming the columns, then one sample per line.
 * Required columns: timestamp, voltage, current, temperature.
 * Optional columns: soc (alias soc_reported), capacity. Other columns are ignored.
 *
 * Example:
 * timestamp,voltage,current,temperature,soc
 * 2025-11-22T08:00:00Z,52.4,12.5,28.7,78.3
 *
 * Only the header is validated here; bad data lines are passed through with
 * missing fields so the normalizer can drop and count them.
 */
@Service
public class CsvTelemetryParser {

    private static final Logger logger = LoggerFactory.getLogger(CsvTelemetryParser.class);

    private static final String[] REQUIRED_COLUMNS = {"timestamp", "voltage", "current", "temperature"};
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public List<TelemetryRow> parse(String csvData) {
        if (csvData == null || csvData.isBlank()) {
            throw new ValidationException("Empty CSV data");
        }

        // Spreadsheet exports often start with a UTF-8 byte order mark
        String content = csvData.charAt(0) == BYTE_ORDER_MARK ? csvData.substring(1) : csvData;
        String[] lines = content.split("\\r?\\n");
        int headerLine = 0;
        while (headerLine < lines.length && lines[headerLine].isBlank()) {
            headerLine++;
        }
        Map<String, Integer> columns = parseHeader(lines[headerLine]);
        logger.debug("CSV header columns: {}", columns.keySet());

        List<TelemetryRow> rows = new ArrayList<>();
        for (int i = headerLine + 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            rows.add(parseLine(line, columns));
        }

        logger.debug("Parsed {} CSV data lines", rows.size());
        return rows;
    }

    private Map<String, Integer> parseHeader(String headerLine) {
        String[] names = splitLine(headerLine);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            String name = canonicalColumn(names[i]);
            if (!name.isEmpty()) {
                columns.putIfAbsent(name, i);
            }
        }

        List<String> missing = new ArrayList<>();
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required columns: " + String.join(", ", missing));
        }
        return columns;
    }

    private TelemetryRow parseLine(String line, Map<String, Integer> columns) {
        String[] values = splitLine(line);
        TelemetryRow row = new TelemetryRow();
        row.timestamp = field(values, columns.get("timestamp"));
        row.voltage = field(values, columns.get("voltage"));
        row.current = field(values, columns.get("current"));
        row.temperature = field(values, columns.get("temperature"));
        row.soc = field(values, columns.get("soc"));
        row.capacity = field(values, columns.get("capacity"));
        return row;
    }

    private static String canonicalColumn(String raw) {
        String name = raw.trim().toLowerCase(Locale.ROOT);
        if (name.equals("soc_reported") || name.equals("state_of_charge")) {
            return "soc";
        }
        return name;
    }

    private static String field(String[] values, Integer index) {
        if (index == null || index >= values.length) {
            return null;
        }
        String value = values[index];
        return value.isEmpty() ? null : value;
    }

    private static String[] splitLine(String line) {
        String[] parts = line.split(",", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i].trim();
            if (part.length() >= 2 && part.startsWith("\"") && part.endsWith("\"")) {
                part = part.substring(1, part.length() - 1).trim();
            }
            parts[i] = part;
        }
        return parts;
    }
}
