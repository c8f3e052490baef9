package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.config.DetectionMode;
import com.motaz.telemetry.engine.model.Batch;
import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.model.ChannelScore;
import com.motaz.telemetry.engine.model.MultivariateResult;
import com.motaz.telemetry.engine.model.OutlierScore;
import com.motaz.telemetry.engine.model.RunningStat;
import com.motaz.telemetry.engine.model.ScoredBatch;
import com.motaz.telemetry.engine.model.ScoredRow;
import com.motaz.telemetry.engine.model.UnivariateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the per-channel and multivariate flaggers over a batch and combines them into one decision per
 * row. The baseline is only read, never modified.
 *
 * <p>Consensus: in {@link DetectionMode#BOTH} a row is anomalous when the forest flags it or any channel's
 * z-score flag is {@code true}. Unknown flags (immature baseline, empty cell, absent channel) count as
 * {@code false}, so a cold-start batch falls back to the forest alone.
 */
@Slf4j
@RequiredArgsConstructor
public class AnomalyEngine {

    private final UnivariateFlagger univariateFlagger;
    private final MultivariateFlagger multivariateFlagger;

    public ScoredBatch run(Batch batch, Collection<String> channels, BaselineTable baseline, DetectionMode mode) {
        List<String> present = batch.presentChannels(channels);
        log.info("Running anomaly detection (mode={}) on {} rows across channels: {}", mode, batch.size(), present);

        Map<String, UnivariateResult> univariate = new LinkedHashMap<>();
        if (mode.usesZScore()) {
            for (String channel : present) {
                univariate.put(channel, scoreChannel(batch, channel, baseline));
            }
        }

        MultivariateResult multivariate = null;
        if (mode.usesMultivariate()) {
            multivariate = multivariateFlagger.flag(batch, present);
        }

        List<ScoredRow> rows = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Map<String, ChannelScore> channelScores = new LinkedHashMap<>();
            boolean anyZScoreFlag = false;
            for (Map.Entry<String, UnivariateResult> entry : univariate.entrySet()) {
                ChannelScore score = entry.getValue().at(i);
                channelScores.put(entry.getKey(), score);
                anyZScoreFlag |= score.isFlagged();
            }
            OutlierScore outlier = multivariate == null ? null : multivariate.at(i);
            rows.add(ScoredRow.builder()
                    .source(batch.getRows().get(i))
                    .channelScores(channelScores)
                    .outlier(outlier)
                    .anomaly(consensus(mode, anyZScoreFlag, outlier))
                    .build());
        }
        return new ScoredBatch(batch, mode, List.copyOf(univariate.keySet()), rows);
    }

    private UnivariateResult scoreChannel(Batch batch, String channel, BaselineTable baseline) {
        RunningStat stat = baseline.statFor(channel).orElse(null);
        UnivariateResult result = univariateFlagger.flag(batch.readings(channel), stat);
        if (stat == null || !stat.isMature(univariateFlagger.getMaturityFloor())) {
            log.info("Z-score skipped for '{}': insufficient baseline history ({}/{} observations)",
                    channel, stat == null ? 0 : stat.getCount(), univariateFlagger.getMaturityFloor());
        } else {
            long flagged = result.flags().stream().filter(Boolean.TRUE::equals).count();
            log.info("Z-score analysis for '{}': {} values exceeded threshold ({})",
                    channel, flagged, univariateFlagger.getThreshold());
        }
        return result;
    }

    private static boolean consensus(DetectionMode mode, boolean anyZScoreFlag, OutlierScore outlier) {
        boolean outlierFlag = outlier != null && outlier.flag();
        return switch (mode) {
            case ZSCORE_ONLY -> anyZScoreFlag;
            case MULTIVARIATE_ONLY -> outlierFlag;
            case BOTH -> anyZScoreFlag || outlierFlag;
        };
    }
}
