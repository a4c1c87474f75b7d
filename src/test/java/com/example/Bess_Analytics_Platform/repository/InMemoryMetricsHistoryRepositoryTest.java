package com.example.Bess_Analytics_Platform.repository;

import com.example.Bess_Analytics_Platform.config.EngineConfig;
import com.example.Bess_Analytics_Platform.model.HealthStatus;
import com.example.Bess_Analytics_Platform.model.MetricFlag;
import com.example.Bess_Analytics_Platform.model.MetricsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMetricsHistoryRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryMetricsHistoryRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMetricsHistoryRepository(EngineConfig.builder().maxHistorySnapshots(3).build());
    }

    @Test
    void testLoadHistory_UnknownBattery_Empty() {
        assertTrue(repository.loadHistory("unknown").isEmpty());
        assertTrue(repository.findLatest("unknown").isEmpty());
    }

    @Test
    void testAppendSnapshot_OldestFirst() {
        // Given
        repository.appendSnapshot(snapshot("battery-001", 0, 1.0));
        repository.appendSnapshot(snapshot("battery-001", 1, 2.0));

        // When
        List<MetricsSnapshot> history = repository.loadHistory("battery-001");

        // Then
        assertEquals(2, history.size());
        assertEquals(1.0, history.get(0).getEquivalentCycles(), 0.0001);
        assertEquals(2.0, repository.findLatest("battery-001").orElseThrow().getEquivalentCycles(), 0.0001);
        assertEquals(List.of("battery-001"), repository.findBatteryIds());
    }

    @Test
    void testAppendSnapshot_DecreasingCyclesRejected() {
        // Given
        repository.appendSnapshot(snapshot("battery-001", 0, 5.0));

        // When & Then
        assertThrows(IllegalStateException.class,
                () -> repository.appendSnapshot(snapshot("battery-001", 1, 4.0)));
        assertEquals(1, repository.loadHistory("battery-001").size());
    }

    @Test
    void testAppendSnapshot_BaselineResetMayDecrease() {
        // Given
        repository.appendSnapshot(snapshot("battery-001", 0, 5.0));
        MetricsSnapshot reset = MetricsSnapshot.builder()
                .batteryId("battery-001")
                .timestamp(T0.plusSeconds(3600))
                .equivalentCycles(0.5)
                .healthStatus(HealthStatus.GOOD)
                .flag(MetricFlag.CYCLE_BASELINE_RESET)
                .build();

        // When
        repository.appendSnapshot(reset);

        // Then
        assertEquals(0.5, repository.findLatest("battery-001").orElseThrow().getEquivalentCycles(), 0.0001);
    }

    @Test
    void testAppendSnapshot_EvictsOldestBeyondLimit() {
        // When
        for (int i = 0; i < 5; i++) {
            repository.appendSnapshot(snapshot("battery-001", i, i));
        }

        // Then
        List<MetricsSnapshot> history = repository.loadHistory("battery-001");
        assertEquals(3, history.size());
        assertEquals(2.0, history.get(0).getEquivalentCycles(), 0.0001);
    }

    @Test
    void testLoadHistory_ReturnsImmutableView() {
        repository.appendSnapshot(snapshot("battery-001", 0, 1.0));

        List<MetricsSnapshot> history = repository.loadHistory("battery-001");

        assertThrows(UnsupportedOperationException.class, () -> history.add(snapshot("battery-001", 1, 2.0)));
    }

    @Test
    void testComputeAndAppend_ConcurrentUpdatesAreNotLost() throws InterruptedException {
        // Given
        int threads = 8;
        int updatesPerThread = 25;
        InMemoryMetricsHistoryRepository unbounded =
                new InMemoryMetricsHistoryRepository(EngineConfig.builder().maxHistorySnapshots(1000).build());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);

        // When - each update adds one cycle on top of the latest stored value
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < updatesPerThread; i++) {
                        unbounded.computeAndAppend("battery-001", history -> {
                            double previous = history.isEmpty() ? 0.0 : history.get(history.size() - 1).getEquivalentCycles();
                            return snapshot("battery-001", history.size(), previous + 1.0);
                        });
                    }
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        List<MetricsSnapshot> history = unbounded.loadHistory("battery-001");
        assertEquals(threads * updatesPerThread, history.size());
        assertEquals(threads * updatesPerThread, history.get(history.size() - 1).getEquivalentCycles(), 0.0001);
    }

    private static MetricsSnapshot snapshot(String batteryId, int hour, double cycles) {
        return MetricsSnapshot.builder()
                .batteryId(batteryId)
                .timestamp(T0.plusSeconds(3600L * hour))
                .equivalentCycles(cycles)
                .healthStatus(HealthStatus.GOOD)
                .build();
    }
}
