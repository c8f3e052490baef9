package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.model.RunningStat;
import com.motaz.telemetry.engine.model.UnivariateResult;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Z-score test of individual readings against a channel's learned baseline.
 */
@Getter
public class UnivariateFlagger {

    private final double threshold;
    private final int maturityFloor;

    public UnivariateFlagger(double threshold, int maturityFloor) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be positive, got " + threshold);
        }
        this.threshold = threshold;
        this.maturityFloor = maturityFloor;
    }

    /**
     * @param values one entry per row, {@code null} for an empty cell
     * @param stat   the channel's baseline, {@code null} if the channel was never seen
     */
    public UnivariateResult flag(List<Double> values, RunningStat stat) {
        int n = values.size();
        if (stat == null || !stat.isMature(maturityFloor)) {
            return new UnivariateResult(Collections.nCopies(n, null), Collections.nCopies(n, null));
        }
        List<Double> zScores = new ArrayList<>(n);
        List<Boolean> flags = new ArrayList<>(n);
        double std = stat.std();
        for (Double value : values) {
            if (value == null || !Double.isFinite(value)) {
                zScores.add(null);
                flags.add(null);
            } else if (std == 0.0) {
                // no spread observed yet: nothing stands out
                zScores.add(0.0);
                flags.add(false);
            } else {
                double z = Math.abs(value - stat.getMean()) / std;
                zScores.add(z);
                flags.add(z > threshold);
            }
        }
        return new UnivariateResult(zScores, flags);
    }
}
