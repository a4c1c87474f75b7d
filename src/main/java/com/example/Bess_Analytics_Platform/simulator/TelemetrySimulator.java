package com.example.Bess_Analytics_Platform.simulator;

import com.example.Bess_Analytics_Platform.dto.TelemetryRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Telemetry Simulator
 *
 * Feeds synthetic battery telemetry to the running service:
 * 1. Healthy cycling battery, two consecutive windows (metrics + history)
 * 2. Faulty battery with injected out-of-range readings (anomaly detection)
 * 3. Hourly aggregation of the healthy battery's data
 *
 * Run with: --simulator.enabled=true
 */
@Component
@ConditionalOnProperty(name = "simulator.enabled", havingValue = "true", matchIfMissing = false)
public class TelemetrySimulator implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(TelemetrySimulator.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final Duration STEP = Duration.ofMinutes(1);
    private static final int WINDOW_SAMPLES = 240;

    private final WebClient webClient;
    private final SyntheticTelemetryGenerator generator;

    public TelemetrySimulator(@Value("${simulator.base-url:http://localhost:8080/api/v1}") String baseUrl,
                              @Value("${simulator.seed:42}") long seed,
                              @Value("${analytics.rated-capacity-ah:100}") double ratedCapacityAh) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Content-Type", "application/json")
                .build();
        this.generator = new SyntheticTelemetryGenerator(seed, ratedCapacityAh);
    }

    @Override
    public void run(String... args) throws Exception {
        logger.info("=".repeat(80));
        logger.info("BESS ANALYTICS - TELEMETRY SIMULATOR");
        logger.info("=".repeat(80));

        // Wait for application to fully start
        Thread.sleep(2000);

        Instant start = Instant.now().truncatedTo(ChronoUnit.HOURS).minus(Duration.ofHours(8));
        List<TelemetryRow> firstWindow = generator.cycling(start, STEP, WINDOW_SAMPLES, 50.0, 85.0);
        List<TelemetryRow> secondWindow = generator.cycling(start.plus(STEP.multipliedBy(WINDOW_SAMPLES)),
                STEP, WINDOW_SAMPLES, 50.0, 50.0);

        try {
            runHealthyBattery(firstWindow, secondWindow);
            runFaultyBattery(start);
            runAggregation(firstWindow);
        } catch (WebClientResponseException e) {
            logger.error("Simulator request failed: {} {}", e.getStatusCode(), e.getResponseBodyAsString());
        }

        logger.info("=".repeat(80));
        logger.info("SIMULATION COMPLETED");
        logger.info("=".repeat(80));
    }

    private void runHealthyBattery(List<TelemetryRow> firstWindow, List<TelemetryRow> secondWindow) {
        logger.info("SCENARIO 1: Healthy cycling battery (sim-healthy-001)");
        postMetrics("sim-healthy-001", firstWindow, "window 1");
        postMetrics("sim-healthy-001", secondWindow, "window 2");
    }

    private void runFaultyBattery(Instant start) {
        logger.info("SCENARIO 2: Battery with injected faults (sim-faulty-002)");
        List<TelemetryRow> rows = generator.withFaults(
                generator.cycling(start, STEP, WINDOW_SAMPLES, 80.0, 60.0), 6);

        Map<String, Object> request = Map.of(
                "battery_id", "sim-faulty-002",
                "data", rows,
                "contamination", 0.05);

        Map<?, ?> response = webClient.post()
                .uri("/anomalies/detect")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(Map.class)
                .timeout(TIMEOUT)
                .block();

        if (response != null) {
            logger.info("Anomalies: {} of {} samples ({}%), summary={}",
                    response.get("anomaly_count"), response.get("total_samples"),
                    response.get("anomaly_percentage"), response.get("summary"));
        }
    }

    private void runAggregation(List<TelemetryRow> rows) {
        logger.info("SCENARIO 3: Hourly aggregation (sim-healthy-001)");
        Map<String, Object> request = Map.of(
                "battery_id", "sim-healthy-001",
                "data", rows,
                "period_seconds", 3600);

        Map<?, ?> response = webClient.post()
                .uri("/aggregate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(Map.class)
                .timeout(TIMEOUT)
                .block();

        if (response != null && response.get("periods") instanceof List) {
            logger.info("Aggregated into {} hourly periods", ((List<?>) response.get("periods")).size());
        }
    }

    private void postMetrics(String batteryId, List<TelemetryRow> rows, String label) {
        Map<?, ?> response = webClient.post()
                .uri("/metrics/{batteryId}", batteryId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("data", rows))
                .retrieve()
                .bodyToMono(Map.class)
                .timeout(TIMEOUT)
                .block();

        if (response != null) {
            logger.info("{} {}: soh={}%, soc={}%, cycles={}, status={}", batteryId, label,
                    response.get("state_of_health"), response.get("current_soc"),
                    response.get("equivalent_cycles"), response.get("health_status"));
        }
    }
}
