package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.engine.config.ScoringOrder;
import com.motaz.telemetry.engine.exception.BaselineConflictException;
import com.motaz.telemetry.engine.exception.MalformedBatchException;
import com.motaz.telemetry.engine.model.Batch;
import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.model.ScoredBatch;
import com.motaz.telemetry.engine.model.Summary;
import com.motaz.telemetry.engine.store.BatchKeyMapper;
import com.motaz.telemetry.engine.store.BatchSink;
import com.motaz.telemetry.engine.store.BatchSource;
import com.motaz.telemetry.engine.store.SummarySink;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Processes one batch end to end: load baseline, fold the batch in, score it, write the outputs and save
 * the baseline.
 *
 * <p>Baseline writes are optimistic. When another batch saved the baseline between our load and our save,
 * the whole cycle is repeated on a fresh read, up to {@code maxAttempts} times. Outputs are written under
 * the same keys on every attempt, and the baseline is written last, so a failed attempt never leaves a
 * baseline that already contains the batch.
 */
@Slf4j
public class BatchProcessor {

    private final BatchSource batchSource;
    private final BatchSink batchSink;
    private final SummarySink summarySink;
    private final BaselineManager baselineManager;
    private final AnomalyEngine anomalyEngine;
    private final DetectionConfig config;
    private final BatchKeyMapper keyMapper;
    private final String baselineKey;
    private final int maxAttempts;
    private final Clock clock;

    @Builder
    public BatchProcessor(BatchSource batchSource, BatchSink batchSink, SummarySink summarySink,
                          BaselineManager baselineManager, AnomalyEngine anomalyEngine, DetectionConfig config,
                          BatchKeyMapper keyMapper, String baselineKey, int maxAttempts, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.batchSource = batchSource;
        this.batchSink = batchSink;
        this.summarySink = summarySink;
        this.baselineManager = baselineManager;
        this.anomalyEngine = anomalyEngine;
        this.config = config;
        this.keyMapper = keyMapper;
        this.baselineKey = baselineKey;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    public Summary process(String sourceKey) {
        log.info("Processing: {}", sourceKey);
        Batch batch = batchSource.read(sourceKey);
        log.info("Loaded {} rows, columns: {}", batch.size(), batch.getColumns());
        return processBatch(sourceKey, batch);
    }

    public Summary processBatch(String sourceKey, Batch batch) {
        List<String> channels = batch.presentChannels(config.channels());
        if (channels.isEmpty()) {
            throw new MalformedBatchException("Batch " + sourceKey + " has none of the configured channels "
                    + config.channels() + " among its columns " + batch.getColumns());
        }
        String outputKey = keyMapper.outputKey(sourceKey);
        String summaryKey = keyMapper.summaryKey(outputKey);

        for (int attempt = 1; ; attempt++) {
            try {
                return processOnce(sourceKey, outputKey, summaryKey, batch, channels);
            } catch (BaselineConflictException e) {
                if (attempt >= maxAttempts) {
                    log.error("Giving up on {} after {} conflicting baseline saves", sourceKey, attempt);
                    throw e;
                }
                log.warn("Baseline changed while processing {} (attempt {}/{}), retrying on a fresh read",
                        sourceKey, attempt, maxAttempts);
            }
        }
    }

    private Summary processOnce(String sourceKey, String outputKey, String summaryKey, Batch batch,
                                List<String> channels) {
        BaselineTable baseline = baselineManager.load(baselineKey);

        ScoredBatch scored;
        if (config.scoringOrder() == ScoringOrder.SCORE_BEFORE_UPDATE) {
            scored = anomalyEngine.run(batch, channels, baseline, config.mode());
            applyBatch(batch, channels, baseline);
        } else {
            applyBatch(batch, channels, baseline);
            scored = anomalyEngine.run(batch, channels, baseline, config.mode());
        }

        Summary summary = Summary.of(sourceKey, outputKey, summaryKey, clock.instant(), scored, baseline,
                config.channels());
        batchSink.put(outputKey, scored);
        summarySink.put(summaryKey, summary);
        baselineManager.save(baselineKey, baseline);

        log.info("Done: {}/{} anomalies flagged for {} -> {}", summary.anomalyCount(), summary.totalRows(),
                sourceKey, outputKey);
        return summary;
    }

    private void applyBatch(Batch batch, List<String> channels, BaselineTable baseline) {
        for (String channel : channels) {
            List<Double> values = batch.presentReadings(channel);
            if (!values.isEmpty()) {
                baselineManager.update(baseline, channel, values);
            }
        }
    }
}
