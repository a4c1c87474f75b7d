package com.example.Bess_Analytics_Platform.model;

/**
 * Cleaned record plus the bookkeeping of what the normalizer dropped.
 */
public final class NormalizationResult {

    private final BatteryRecord record;
    private final int inputCount;
    private final int rejectedCount;
    private final int duplicateCount;
    private final boolean resampled;

    public NormalizationResult(BatteryRecord record, int inputCount, int rejectedCount,
                               int duplicateCount, boolean resampled) {
        this.record = record;
        this.inputCount = inputCount;
        this.rejectedCount = rejectedCount;
        this.duplicateCount = duplicateCount;
        this.resampled = resampled;
    }

    public BatteryRecord getRecord() { return record; }
    public int getInputCount() { return inputCount; }
    public int getRejectedCount() { return rejectedCount; }
    public int getDuplicateCount() { return duplicateCount; }
    public boolean isResampled() { return resampled; }

    /** Rows that survived validation (before resampling collapses them). */
    public int getAcceptedCount() {
        return inputCount - rejectedCount;
    }

    @Override
    public String toString() {
        return String.format("Normalization{id='%s', input=%d, rejected=%d, duplicates=%d, output=%d, resampled=%s}",
                record.getBatteryId(), inputCount, rejectedCount, duplicateCount, record.size(), resampled);
    }
}
