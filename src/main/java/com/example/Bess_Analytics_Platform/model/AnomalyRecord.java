package com.example.Bess_Analytics_Platform.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One flagged sample. A sample flagged by several checks carries every type
 * in a single record.
 */
public final class AnomalyRecord {

    private final Instant timestamp;
    private final int sampleIndex;
    private final Set<AnomalyType> types;
    private final Map<String, Double> values;
    private final Double outlierScore;
    private final Severity severity;

    public AnomalyRecord(Instant timestamp, int sampleIndex, Set<AnomalyType> types,
                         Map<String, Double> values, Double outlierScore, Severity severity) {
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("An anomaly record needs at least one type");
        }
        this.sampleIndex = sampleIndex;
        this.types = Collections.unmodifiableSet(EnumSet.copyOf(types));
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.outlierScore = outlierScore;
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
    }

    public Instant getTimestamp() { return timestamp; }
    public int getSampleIndex() { return sampleIndex; }
    public Set<AnomalyType> getTypes() { return types; }
    public Map<String, Double> getValues() { return values; }
    public Double getOutlierScore() { return outlierScore; }
    public Severity getSeverity() { return severity; }

    public boolean hasType(AnomalyType type) {
        return types.contains(type);
    }

    @Override
    public String toString() {
        return String.format("Anomaly{t=%s, index=%d, types=%s, severity=%s}", timestamp, sampleIndex, types, severity);
    }
}
