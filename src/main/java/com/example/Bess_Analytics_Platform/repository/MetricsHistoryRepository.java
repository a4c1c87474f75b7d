package com.example.Bess_Analytics_Platform.repository;

import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Per-battery store of metrics snapshots, oldest first.
 */
public interface MetricsHistoryRepository {

    /** All stored snapshots for the battery, oldest first; empty when unknown. */
    List<MetricsSnapshot> loadHistory(String batteryId);

    Optional<MetricsSnapshot> findLatest(String batteryId);

    /** Battery IDs with at least one stored snapshot. */
    List<String> findBatteryIds();

    /**
     * Append a snapshot.
     *
     * @throws IllegalStateException when the snapshot's equivalent cycles are
     *                               below the latest stored value
     */
    void appendSnapshot(MetricsSnapshot snapshot);

    /**
     * Compute a snapshot from the current history and append it, with no other
     * update for the same battery in between.
     */
    MetricsSnapshot computeAndAppend(String batteryId, Function<List<MetricsSnapshot>, MetricsSnapshot> calculation);
}
