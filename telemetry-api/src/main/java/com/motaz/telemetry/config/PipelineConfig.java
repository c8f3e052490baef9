package com.motaz.telemetry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.engine.service.AnomalyEngine;
import com.motaz.telemetry.engine.service.BaselineManager;
import com.motaz.telemetry.engine.service.BatchProcessor;
import com.motaz.telemetry.engine.service.MultivariateFlagger;
import com.motaz.telemetry.engine.service.UnivariateFlagger;
import com.motaz.telemetry.engine.store.BaselineJsonCodec;
import com.motaz.telemetry.engine.store.BatchKeyMapper;
import com.motaz.telemetry.services.BatchSummaryService;
import com.motaz.telemetry.services.FileBatchStorage;
import com.motaz.telemetry.services.JpaBaselineStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engine components, which carry no Spring annotations of their own.
 */
@Configuration
public class PipelineConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    DetectionConfig detectionConfig(TelemetryProperties properties) {
        return properties.toConfig();
    }

    @Bean
    BaselineJsonCodec baselineJsonCodec(ObjectMapper objectMapper) {
        return new BaselineJsonCodec(objectMapper);
    }

    @Bean
    BatchKeyMapper batchKeyMapper(TelemetryProperties properties) {
        return BatchKeyMapper.prefixSwap(properties.storage().rawPrefix(), properties.storage().processedPrefix());
    }

    @Bean
    BaselineManager baselineManager(JpaBaselineStore baselineStore, Clock clock) {
        return new BaselineManager(baselineStore, clock);
    }

    @Bean
    AnomalyEngine anomalyEngine(DetectionConfig config) {
        return new AnomalyEngine(
                new UnivariateFlagger(config.zThreshold(), config.maturityFloor()),
                new MultivariateFlagger(config.contamination(), config.randomSeed(), config.trees()));
    }

    @Bean
    BatchProcessor batchProcessor(FileBatchStorage storage, BatchSummaryService summaryService,
                                  BaselineManager baselineManager, AnomalyEngine anomalyEngine,
                                  DetectionConfig config, BatchKeyMapper keyMapper,
                                  TelemetryProperties properties, Clock clock) {
        return BatchProcessor.builder()
                .batchSource(storage)
                .batchSink(storage)
                .summarySink(summaryService)
                .baselineManager(baselineManager)
                .anomalyEngine(anomalyEngine)
                .config(config)
                .keyMapper(keyMapper)
                .baselineKey(properties.baseline().key())
                .maxAttempts(properties.baseline().maxAttempts())
                .clock(clock)
                .build();
    }
}
