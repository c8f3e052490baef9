package com.motaz.telemetry.engine.model;

import com.motaz.telemetry.engine.exception.InvalidValueException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Incremental mean and variance of one channel (Welford). No history is retained.
 *
 * <p>Variance is the population variance {@code m2 / count}. The standard deviation is reported as
 * {@code 0} until two observations have been seen.
 */
@Getter
@ToString
@EqualsAndHashCode
public class RunningStat {

    private long count;
    private double mean;
    private double m2;

    public RunningStat() {
    }

    private RunningStat(long count, double mean, double m2) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    /**
     * Rebuilds a statistic from persisted fields, validating its invariants.
     */
    public static RunningStat restore(long count, double mean, double m2) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got " + count);
        }
        if (!Double.isFinite(mean) || !Double.isFinite(m2) || m2 < 0) {
            throw new IllegalArgumentException("mean/m2 must be finite and m2 non-negative, got mean="
                    + mean + " m2=" + m2);
        }
        if (count == 0 && (mean != 0.0 || m2 != 0.0)) {
            throw new IllegalArgumentException("an empty statistic must have zero mean and m2");
        }
        return new RunningStat(count, mean, m2);
    }

    public RunningStat copy() {
        return new RunningStat(count, mean, m2);
    }

    public void update(double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidValueException(value);
        }
        // mean must move before delta2 is taken
        count += 1;
        double delta = value - mean;
        mean += delta / count;
        double delta2 = value - mean;
        m2 += delta * delta2;
    }

    /**
     * Applies {@link #update(double)} to each value in order. Stops at the first non-finite value,
     * keeping the values before it.
     */
    public void update(Iterable<Double> values) {
        for (Double value : values) {
            update(value.doubleValue());
        }
    }

    public double variance() {
        return count == 0 ? 0.0 : m2 / count;
    }

    public double std() {
        return count < 2 ? 0.0 : Math.sqrt(variance());
    }

    public boolean isMature(int maturityFloor) {
        return count >= maturityFloor;
    }
}
