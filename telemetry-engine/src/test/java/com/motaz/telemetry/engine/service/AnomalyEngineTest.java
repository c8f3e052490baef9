package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.config.DetectionMode;
import com.motaz.telemetry.engine.model.Batch;
import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.model.ChannelScore;
import com.motaz.telemetry.engine.model.RunningStat;
import com.motaz.telemetry.engine.model.ScoredBatch;
import com.motaz.telemetry.engine.model.ScoredRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyEngineTest {

    private static final List<String> CHANNELS = List.of("temperature", "humidity", "pressure");

    private final AnomalyEngine engine = new AnomalyEngine(
            new UnivariateFlagger(3.0, 30),
            new MultivariateFlagger(0.05, 42L, 100));

    @Test
    void coldStartFallsBackToForestAlone() {
        Batch batch = sensorBatch(50, 9);
        BaselineTable immature = BaselineTable.empty();
        immature.put("temperature", RunningStat.restore(10, 22.0, 22.5));

        ScoredBatch both = engine.run(batch, CHANNELS, immature, DetectionMode.BOTH);
        ScoredBatch forestOnly = engine.run(batch, CHANNELS, immature, DetectionMode.MULTIVARIATE_ONLY);

        assertThat(both.getRows()).extracting(ScoredRow::isAnomaly)
                .containsExactlyElementsOf(forestOnly.getRows().stream().map(ScoredRow::isAnomaly).toList());
        assertThat(both.getRows()).allSatisfy(row ->
                assertThat(row.channelScore("temperature")).isEqualTo(ChannelScore.UNKNOWN));
    }

    @Test
    void spikeAgainstMatureBaselineIsFlagged() {
        BaselineTable baseline = BaselineTable.empty();
        baseline.put("temperature", RunningStat.restore(100, 22.0, 225.0));
        Batch batch = Batch.ofReadings(List.of("temperature"), List.of(Map.of("temperature", 40.0)));

        ScoredBatch scored = engine.run(batch, CHANNELS, baseline, DetectionMode.BOTH);

        ScoredRow row = scored.getRows().get(0);
        assertThat(row.channelScore("temperature").zScore()).isCloseTo(12.0, within(1e-9));
        assertThat(row.channelScore("temperature").flag()).isTrue();
        assertThat(row.isAnomaly()).isTrue();
        assertThat(scored.anomalyCount()).isEqualTo(1);
    }

    @Test
    void zScoreOnlyIgnoresTheForest() {
        BaselineTable baseline = BaselineTable.empty();
        baseline.put("temperature", RunningStat.restore(100, 22.0, 225.0));
        Batch batch = Batch.ofReadings(List.of("temperature"),
                List.of(Map.of("temperature", 22.5), Map.of("temperature", 21.0), Map.of("temperature", 40.0)));

        ScoredBatch scored = engine.run(batch, CHANNELS, baseline, DetectionMode.ZSCORE_ONLY);

        assertThat(scored.hasOutlierColumns()).isFalse();
        assertThat(scored.getRows()).allSatisfy(row -> assertThat(row.getOutlier()).isNull());
        assertThat(scored.getRows()).extracting(ScoredRow::isAnomaly).containsExactly(false, false, true);
    }

    @Test
    void forestOnlyProducesNoChannelScores() {
        ScoredBatch scored = engine.run(sensorBatch(20, 4), CHANNELS, BaselineTable.empty(),
                DetectionMode.MULTIVARIATE_ONLY);

        assertThat(scored.getScoredChannels()).isEmpty();
        assertThat(scored.getRows()).allSatisfy(row -> {
            assertThat(row.getChannelScores()).isEmpty();
            assertThat(row.getOutlier()).isNotNull();
            assertThat(row.isAnomaly()).isEqualTo(row.getOutlier().flag());
        });
    }

    @Test
    void absentChannelsAreNotScored() {
        Batch batch = Batch.ofReadings(List.of("temperature", "humidity"), rows(10, 2));

        ScoredBatch scored = engine.run(batch, CHANNELS, BaselineTable.empty(), DetectionMode.BOTH);

        assertThat(scored.getScoredChannels()).containsExactly("temperature", "humidity");
    }

    @Test
    void leavesBaselineUntouched() {
        BaselineTable baseline = BaselineTable.empty();
        baseline.put("temperature", RunningStat.restore(100, 22.0, 225.0));
        baseline.put("humidity", RunningStat.restore(40, 50.0, 1000.0));
        RunningStat temperatureBefore = baseline.statFor("temperature").orElseThrow().copy();

        engine.run(sensorBatch(30, 1), CHANNELS, baseline, DetectionMode.BOTH);

        assertThat(baseline.getChannels()).containsOnlyKeys("temperature", "humidity");
        assertThat(baseline.statFor("temperature")).contains(temperatureBefore);
    }

    @Test
    void emptyBatchGivesEmptyResult() {
        Batch batch = Batch.ofReadings(CHANNELS, List.of());

        ScoredBatch scored = engine.run(batch, CHANNELS, BaselineTable.empty(), DetectionMode.BOTH);

        assertThat(scored.totalRows()).isZero();
        assertThat(scored.anomalyCount()).isZero();
    }

    private static Batch sensorBatch(int n, long seed) {
        return Batch.ofReadings(CHANNELS, rows(n, seed));
    }

    private static List<Map<String, Double>> rows(int n, long seed) {
        Random random = new Random(seed);
        List<Map<String, Double>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Map<String, Double> row = new HashMap<>();
            row.put("temperature", 22.0 + random.nextGaussian() * 1.5);
            row.put("humidity", 50.0 + random.nextGaussian() * 5.0);
            row.put("pressure", 1013.0 + random.nextGaussian() * 2.0);
            rows.add(row);
        }
        return rows;
    }
}
