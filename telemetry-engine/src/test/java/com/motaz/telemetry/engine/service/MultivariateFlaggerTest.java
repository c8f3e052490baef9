package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.model.Batch;
import com.motaz.telemetry.engine.model.MultivariateResult;
import com.motaz.telemetry.engine.model.OutlierLabel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MultivariateFlaggerTest {

    private static final List<String> COLUMNS = List.of("temperature", "humidity");

    private final MultivariateFlagger flagger = new MultivariateFlagger(0.05, 42L, 100);

    @Test
    void sameBatchAndSeedGiveSameResult() {
        Batch batch = gaussianBatch(80, 7);

        MultivariateResult first = flagger.flag(batch, COLUMNS);
        MultivariateResult second = new MultivariateFlagger(0.05, 42L, 100).flag(batch, COLUMNS);

        assertThat(second.labels()).isEqualTo(first.labels());
        assertThat(second.scores()).containsExactly(first.scores());
    }

    @Test
    void anomaliesAlwaysScoreBelowNormalRows() {
        MultivariateResult result = flagger.flag(gaussianBatch(120, 11), COLUMNS);

        double maxAnomaly = Double.NEGATIVE_INFINITY;
        double minNormal = Double.POSITIVE_INFINITY;
        for (int i = 0; i < result.size(); i++) {
            if (result.labels().get(i) == OutlierLabel.ANOMALY) {
                maxAnomaly = Math.max(maxAnomaly, result.scores()[i]);
                assertThat(result.scores()[i]).isNegative();
            } else {
                minNormal = Math.min(minNormal, result.scores()[i]);
            }
        }
        assertThat(result.flaggedCount()).isPositive();
        assertThat(maxAnomaly).isLessThan(minNormal);
    }

    @Test
    void flagsRoughlyTheContaminationShare() {
        MultivariateResult result = flagger.flag(gaussianBatch(200, 5), COLUMNS);

        assertThat(result.flaggedCount()).isBetween(1L, 12L);
    }

    @Test
    void extremeRowIsTheStrongestOutlier() {
        List<Map<String, Double>> rows = gaussianRows(60, 3);
        rows.add(Map.of("temperature", 95.0, "humidity", 2.0));
        Batch batch = Batch.ofReadings(COLUMNS, rows);

        MultivariateResult result = flagger.flag(batch, COLUMNS);

        int last = rows.size() - 1;
        assertThat(result.labels().get(last)).isEqualTo(OutlierLabel.ANOMALY);
        assertThat(result.scores()[last]).isEqualTo(Arrays.stream(result.scores()).min().orElseThrow());
    }

    @Test
    void singleRowIsNormal() {
        MultivariateResult result = flagger.flag(gaussianBatch(1, 1), COLUMNS);

        assertThat(result.labels()).containsExactly(OutlierLabel.NORMAL);
        assertThat(result.scores()).containsExactly(0.0);
    }

    @Test
    void twoRowBatchIsNormal() {
        Batch batch = Batch.ofReadings(COLUMNS, List.of(reading(20.0, 50.0), reading(21.0, 49.0)));

        MultivariateResult result = flagger.flag(batch, COLUMNS);

        assertThat(result.labels()).containsExactly(OutlierLabel.NORMAL, OutlierLabel.NORMAL);
        assertThat(result.flaggedCount()).isZero();
    }

    @Test
    void emptyBatchGivesEmptyResult() {
        MultivariateResult result = flagger.flag(Batch.ofReadings(COLUMNS, List.of()), COLUMNS);

        assertThat(result.size()).isZero();
    }

    @Test
    void imputesMissingCellsWithColumnMedian() {
        List<Map<String, Double>> rows = new ArrayList<>();
        rows.add(reading(1.0, 10.0));
        rows.add(reading(null, 20.0));
        rows.add(reading(3.0, Double.NaN));
        rows.add(reading(5.0, 40.0));
        Batch batch = Batch.ofReadings(COLUMNS, rows);

        double[][] matrix = flagger.featureMatrix(batch, COLUMNS);

        assertThat(matrix[1][0]).isEqualTo(3.0);
        assertThat(matrix[2][1]).isEqualTo(20.0);
        assertThat(flagger.flag(batch, COLUMNS).size()).isEqualTo(4);
    }

    @Test
    void dropsColumnsWithoutAnyValue() {
        List<Map<String, Double>> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(reading(20.0 + i, null));
        }
        Batch batch = Batch.ofReadings(COLUMNS, rows);

        double[][] matrix = flagger.featureMatrix(batch, COLUMNS);

        assertThat(matrix).hasNumberOfRows(10);
        assertThat(matrix[0]).hasSize(1);
        assertThat(flagger.flag(batch, COLUMNS).size()).isEqualTo(10);
    }

    @Test
    void medianAndPercentileInterpolate() {
        assertThat(MultivariateFlagger.median(List.of(4.0, 1.0, 3.0))).isEqualTo(3.0);
        assertThat(MultivariateFlagger.median(List.of(4.0, 1.0, 3.0, 2.0))).isEqualTo(2.5);
        assertThat(MultivariateFlagger.percentile(new double[]{0, 10, 20, 30, 40}, 50)).isEqualTo(20.0);
        assertThat(MultivariateFlagger.percentile(new double[]{0, 10, 20, 30, 40}, 5)).isCloseTo(2.0, within(1e-12));
        double tied = -0.5773502691896258;
        assertThat(MultivariateFlagger.percentile(new double[]{tied, tied}, 5)).isEqualTo(tied);
        assertThat(MultivariateFlagger.percentile(new double[]{tied, tied, 1.0}, 30)).isEqualTo(tied);
    }

    private static Batch gaussianBatch(int n, long seed) {
        return Batch.ofReadings(COLUMNS, gaussianRows(n, seed));
    }

    private static List<Map<String, Double>> gaussianRows(int n, long seed) {
        Random random = new Random(seed);
        List<Map<String, Double>> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            rows.add(reading(22.0 + random.nextGaussian() * 1.5, 50.0 + random.nextGaussian() * 5.0));
        }
        return rows;
    }

    private static Map<String, Double> reading(Double temperature, Double humidity) {
        Map<String, Double> row = new HashMap<>();
        row.put("temperature", temperature);
        row.put("humidity", humidity);
        return row;
    }
}
