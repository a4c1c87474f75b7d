package com.example.Bess_Analytics_Platform.config;

import com.example.Bess_Analytics_Platform.exception.ConfigurationException;
import com.example.Bess_Analytics_Platform.model.Channel;
import com.example.Bess_Analytics_Platform.model.ChannelBounds;
import com.example.Bess_Analytics_Platform.service.IsolationForestScorer;
import com.example.Bess_Analytics_Platform.service.OutlierScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the analytics engine collaborators.
 *
 * Settings are read once from {@link AnalyticsProperties} and frozen into an
 * {@link EngineConfig}; invalid settings fail startup.
 */
@Configuration
public class AnalyticsConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AnalyticsConfiguration.class);

    @Bean
    public EngineConfig engineConfig(AnalyticsProperties properties) {
        EngineConfig config = toEngineConfig(properties);
        logger.info("Analytics engine configured: {}", config);
        return config;
    }

    /**
     * Isolation forest scorer used by the statistical anomaly pass.
     */
    @Bean
    public OutlierScorer outlierScorer(EngineConfig engineConfig) {
        return new IsolationForestScorer(engineConfig.getTrees(), engineConfig.getSubsampleSize(), engineConfig.getRandomSeed());
    }

    /**
     * Bounded pool that runs anomaly detection alongside metrics calculation.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analyticsExecutor(EngineConfig engineConfig) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "analytics-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(engineConfig.getWorkerThreads(), threadFactory);
    }

    static EngineConfig toEngineConfig(AnalyticsProperties properties) {
        EngineConfig.Builder builder = EngineConfig.builder()
                .ratedCapacityAh(properties.getRatedCapacityAh())
                .nominalVoltage(properties.getNominalVoltage())
                .goodThreshold(properties.getHealth().getGoodThreshold())
                .warningThreshold(properties.getHealth().getWarningThreshold())
                .minSocSwing(properties.getMetrics().getMinSocSwing())
                .defaultContamination(properties.getAnomaly().getDefaultContamination())
                .minStatisticalSamples(properties.getAnomaly().getMinStatisticalSamples())
                .trees(properties.getAnomaly().getTrees())
                .subsampleSize(properties.getAnomaly().getSubsampleSize())
                .randomSeed(properties.getAnomaly().getRandomSeed())
                .zScoreThreshold(properties.getAnomaly().getStdDevThreshold())
                .suddenChangeThreshold(properties.getAnomaly().getSuddenChangeThreshold())
                .patternWindow(properties.getAnomaly().getPatternWindow())
                .maxHistorySnapshots(properties.getHistory().getMaxSnapshots())
                .workerThreads(properties.getEngine().getWorkerThreads());

        // Configured bounds replace the built-in ones; channels left out have no threshold check
        for (Channel channel : Channel.values()) {
            builder.bounds(channel, null);
        }
        for (Map.Entry<String, AnalyticsProperties.Bounds> entry : properties.getAnomaly().getDefaultBounds().entrySet()) {
            Channel channel = Channel.fromKey(entry.getKey());
            if (channel == null) {
                throw new ConfigurationException("Unknown channel in analytics.anomaly.default-bounds: " + entry.getKey());
            }
            AnalyticsProperties.Bounds bounds = entry.getValue();
            builder.bounds(channel, ChannelBounds.of(bounds.getMin(), bounds.getMax()));
        }
        return builder.build();
    }
}
