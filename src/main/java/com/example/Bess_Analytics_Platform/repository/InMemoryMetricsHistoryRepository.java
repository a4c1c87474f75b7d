package com.example.Bess_Analytics_Platform.repository;

import com.example.Bess_Analytics_Platform.config.EngineConfig;
import com.example.Bess_Analytics_Platform.model.MetricFlag;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Thread-safe in-memory history.
 * Updates for one battery are serialized through ConcurrentHashMap.compute;
 * readers get immutable copies. Oldest snapshots are evicted beyond the
 * configured maximum.
 */
@Repository
public class InMemoryMetricsHistoryRepository implements MetricsHistoryRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryMetricsHistoryRepository.class);

    private final Map<String, List<MetricsSnapshot>> histories = new ConcurrentHashMap<>();
    private final int maxSnapshots;

    public InMemoryMetricsHistoryRepository(EngineConfig config) {
        this.maxSnapshots = config.getMaxHistorySnapshots();
    }

    @Override
    public List<MetricsSnapshot> loadHistory(String batteryId) {
        List<MetricsSnapshot> history = histories.get(batteryId);
        return history == null ? Collections.emptyList() : history;
    }

    @Override
    public Optional<MetricsSnapshot> findLatest(String batteryId) {
        List<MetricsSnapshot> history = loadHistory(batteryId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public List<String> findBatteryIds() {
        List<String> ids = new ArrayList<>(histories.keySet());
        Collections.sort(ids);
        return ids;
    }

    @Override
    public void appendSnapshot(MetricsSnapshot snapshot) {
        histories.compute(snapshot.getBatteryId(), (id, current) -> append(current, snapshot));
    }

    @Override
    public MetricsSnapshot computeAndAppend(String batteryId, Function<List<MetricsSnapshot>, MetricsSnapshot> calculation) {
        MetricsSnapshot[] result = new MetricsSnapshot[1];
        histories.compute(batteryId, (id, current) -> {
            List<MetricsSnapshot> history = current == null ? Collections.emptyList() : current;
            MetricsSnapshot snapshot = calculation.apply(history);
            result[0] = snapshot;
            return append(current, snapshot);
        });
        return result[0];
    }

    private List<MetricsSnapshot> append(List<MetricsSnapshot> current, MetricsSnapshot snapshot) {
        List<MetricsSnapshot> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
        if (!next.isEmpty() && !snapshot.hasFlag(MetricFlag.CYCLE_BASELINE_RESET)) {
            MetricsSnapshot latest = next.get(next.size() - 1);
            if (snapshot.getEquivalentCycles() < latest.getEquivalentCycles()) {
                throw new IllegalStateException(String.format(
                        "Equivalent cycles for %s cannot decrease: %.4f -> %.4f",
                        snapshot.getBatteryId(), latest.getEquivalentCycles(), snapshot.getEquivalentCycles()));
            }
        }
        next.add(snapshot);
        while (next.size() > maxSnapshots) {
            next.remove(0);
        }
        logger.info("Stored snapshot for {} ({} in history): soh={}%, cycles={}",
                snapshot.getBatteryId(), next.size(),
                String.format("%.2f", snapshot.getStateOfHealth()),
                String.format("%.3f", snapshot.getEquivalentCycles()));
        return Collections.unmodifiableList(next);
    }
}
