package com.example.Bess_Analytics_Platform.config;

import com.example.Bess_Analytics_Platform.exception.ConfigurationException;
import com.example.Bess_Analytics_Platform.model.Channel;
import com.example.Bess_Analytics_Platform.service.IsolationForestScorer;
import com.example.Bess_Analytics_Platform.service.OutlierScorer;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the properties -> EngineConfig conversion and engine settings validation
 */
class AnalyticsConfigurationTest {

    private final AnalyticsConfiguration configuration = new AnalyticsConfiguration();

    @Test
    void testToEngineConfig_Defaults() {
        // When
        EngineConfig config = AnalyticsConfiguration.toEngineConfig(new AnalyticsProperties());

        // Then
        assertEquals(100.0, config.getRatedCapacityAh(), 0.001);
        assertEquals(90.0, config.getGoodThreshold(), 0.001);
        assertEquals(70.0, config.getWarningThreshold(), 0.001);
        assertEquals(0.05, config.getDefaultContamination(), 0.0001);
        assertEquals(3, config.getDefaultBounds().size());
        assertEquals(40.0, config.getDefaultBounds().get(Channel.VOLTAGE).getMin(), 0.001);
        assertEquals(50.0, config.getDefaultBounds().get(Channel.TEMPERATURE).getMax(), 0.001);
    }

    @Test
    void testToEngineConfig_ConfiguredBoundsReplaceDefaults() {
        // Given
        AnalyticsProperties properties = new AnalyticsProperties();
        Map<String, AnalyticsProperties.Bounds> bounds = new LinkedHashMap<>();
        bounds.put("voltage", new AnalyticsProperties.Bounds(700.0, 900.0));
        properties.getAnomaly().setDefaultBounds(bounds);

        // When
        EngineConfig config = AnalyticsConfiguration.toEngineConfig(properties);

        // Then
        assertEquals(1, config.getDefaultBounds().size());
        assertEquals(900.0, config.getDefaultBounds().get(Channel.VOLTAGE).getMax(), 0.001);
    }

    @Test
    void testToEngineConfig_StatisticalCheckSettings() {
        // Given
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getAnomaly().setStdDevThreshold(2.5);
        properties.getAnomaly().setSuddenChangeThreshold(4.0);
        properties.getAnomaly().setPatternWindow(30);

        // When
        EngineConfig config = AnalyticsConfiguration.toEngineConfig(properties);

        // Then
        assertEquals(2.5, config.getZScoreThreshold(), 0.001);
        assertEquals(4.0, config.getSuddenChangeThreshold(), 0.001);
        assertEquals(30, config.getPatternWindow());
    }

    @Test
    void testToEngineConfig_TinyPatternWindowFails() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getAnomaly().setPatternWindow(2);

        assertThrows(ConfigurationException.class, () -> AnalyticsConfiguration.toEngineConfig(properties));
    }

    @Test
    void testToEngineConfig_UnknownChannelFails() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getAnomaly().getDefaultBounds().put("pressure", new AnalyticsProperties.Bounds(0.0, 1.0));

        assertThrows(ConfigurationException.class, () -> AnalyticsConfiguration.toEngineConfig(properties));
    }

    @Test
    void testToEngineConfig_InvalidContaminationFails() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getAnomaly().setDefaultContamination(0.0);

        assertThrows(ConfigurationException.class, () -> AnalyticsConfiguration.toEngineConfig(properties));
    }

    @Test
    void testToEngineConfig_InvertedHealthThresholdsFail() {
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getHealth().setGoodThreshold(60.0);
        properties.getHealth().setWarningThreshold(80.0);

        assertThrows(ConfigurationException.class, () -> AnalyticsConfiguration.toEngineConfig(properties));
    }

    @Test
    void testEngineConfig_RejectsNonPositiveCapacity() {
        assertThrows(ConfigurationException.class, () -> EngineConfig.builder().ratedCapacityAh(0.0).build());
        assertThrows(ConfigurationException.class, () -> EngineConfig.builder().workerThreads(0).build());
    }

    @Test
    void testValidateContamination_OpenInterval() {
        assertEquals(0.5, EngineConfig.validateContamination(0.5), 0.0001);
        assertThrows(ConfigurationException.class, () -> EngineConfig.validateContamination(0.0));
        assertThrows(ConfigurationException.class, () -> EngineConfig.validateContamination(1.0));
        assertThrows(ConfigurationException.class, () -> EngineConfig.validateContamination(Double.NaN));
    }

    @Test
    void testOutlierScorerBean_IsIsolationForest() {
        OutlierScorer scorer = configuration.outlierScorer(EngineConfig.defaults());

        assertTrue(scorer instanceof IsolationForestScorer);
        assertEquals("isolation_forest", scorer.name());
    }

    @Test
    void testAnalyticsExecutor_NamedWorkerThreads() throws Exception {
        // Given
        ExecutorService executor = configuration.analyticsExecutor(EngineConfig.builder().workerThreads(2).build());

        try {
            // When
            Future<String> name = executor.submit(() -> Thread.currentThread().getName());

            // Then
            assertTrue(name.get(5, TimeUnit.SECONDS).startsWith("analytics-worker-"));
        } finally {
            executor.shutdownNow();
        }
    }
}
