package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.model.Batch;
import com.motaz.telemetry.engine.model.MultivariateResult;
import com.motaz.telemetry.engine.model.OutlierLabel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;

/**
 * Batch-local isolation forest over the numeric channels of one batch.
 *
 * <p>The forest is fitted fresh for every batch and never persisted. Smile's anomaly score
 * (higher = more isolated) is turned into a decision score: its negation, shifted so that the
 * {@code contamination} quantile sits at zero. Rows scoring below zero are labelled
 * {@link OutlierLabel#ANOMALY}, so lower always means more anomalous.
 */
@Slf4j
@Getter
public class MultivariateFlagger {

    private static final int MAX_SAMPLES = 256;
    private static final int MIN_ROWS = 2;
    // Smile takes a subsample fraction strictly below one
    private static final double MAX_SAMPLING_RATE = 0.99;

    private final double contamination;
    private final long seed;
    private final int trees;

    public MultivariateFlagger(double contamination, long seed, int trees) {
        if (!(contamination > 0 && contamination < 1)) {
            throw new IllegalArgumentException("contamination must be in (0, 1), got " + contamination);
        }
        this.contamination = contamination;
        this.seed = seed;
        this.trees = trees;
    }

    public MultivariateResult flag(Batch batch, List<String> numericColumns) {
        int n = batch.size();
        double[][] features = featureMatrix(batch, numericColumns);
        if (n < MIN_ROWS || features.length == 0 || features[0].length == 0) {
            log.info("Isolation forest skipped: {} rows, {} usable columns", n,
                    features.length == 0 ? 0 : features[0].length);
            return new MultivariateResult(Collections.nCopies(n, OutlierLabel.NORMAL), new double[n]);
        }

        IsolationForest forest = fit(features);
        double[] anomalyScores = forest.score(features);

        double[] raw = new double[n];
        for (int i = 0; i < n; i++) {
            raw[i] = -anomalyScores[i];
        }
        double offset = percentile(raw, 100.0 * contamination);

        List<OutlierLabel> labels = new ArrayList<>(n);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = raw[i] - offset;
            labels.add(scores[i] < 0 ? OutlierLabel.ANOMALY : OutlierLabel.NORMAL);
        }
        MultivariateResult result = new MultivariateResult(labels, scores);
        log.info("Isolation forest analysis: {}/{} rows flagged as anomalous", result.flaggedCount(), n);
        return result;
    }

    /**
     * Rows x usable columns. Empty or non-finite cells take the column median; columns with no
     * usable value at all are left out.
     */
    double[][] featureMatrix(Batch batch, List<String> numericColumns) {
        int n = batch.size();
        List<double[]> columns = new ArrayList<>();
        for (String column : numericColumns) {
            List<Double> values = batch.readings(column);
            List<Double> present = values.stream()
                    .filter(v -> v != null && Double.isFinite(v))
                    .toList();
            if (present.isEmpty()) {
                log.info("Column '{}' has no usable values in this batch, excluded from the forest", column);
                continue;
            }
            double median = median(present);
            double[] filled = new double[n];
            for (int i = 0; i < n; i++) {
                Double v = values.get(i);
                filled[i] = v == null || !Double.isFinite(v) ? median : v;
            }
            columns.add(filled);
        }
        double[][] matrix = new double[n][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] column = columns.get(j);
            for (int i = 0; i < n; i++) {
                matrix[i][j] = column[i];
            }
        }
        return matrix;
    }

    private IsolationForest fit(double[][] features) {
        int n = features.length;
        double samplingRate = Math.min(MAX_SAMPLING_RATE, MAX_SAMPLES / (double) n);
        int sampleSize = Math.max(1, (int) Math.round(samplingRate * n));
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2)));

        Properties params = new Properties();
        params.setProperty("smile.isolation_forest.trees", String.valueOf(trees));
        params.setProperty("smile.isolation_forest.max_depth", String.valueOf(maxDepth));
        params.setProperty("smile.isolation_forest.sampling_rate", String.valueOf(samplingRate));
        params.setProperty("smile.isolation_forest.extension_level", "0");
        log.debug("Fitting isolation forest: rows={} trees={} samplingRate={} maxDepth={}", n, trees, samplingRate, maxDepth);

        // Smile draws from a per-thread generator; one seeded worker makes the fit repeatable.
        ForkJoinPool pool = new ForkJoinPool(1);
        try {
            return pool.submit(() -> {
                MathEx.setSeed(seed);
                return IsolationForest.fit(features, params);
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fitting isolation forest", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Isolation forest fit failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    static double median(List<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int n = sorted.length;
        return n % 2 == 1 ? sorted[n / 2] : 0.5 * (sorted[n / 2 - 1] + sorted[n / 2]);
    }

    /** Linear-interpolated percentile, {@code pct} in [0, 100]. */
    static double percentile(double[] values, double pct) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double index = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }
}
