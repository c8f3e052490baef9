package com.motaz.telemetry.engine.model;

import java.util.List;

/**
 * Per-row z-scores and flags for one channel. Entries are {@code null} where the result is unknown.
 */
public record UnivariateResult(List<Double> zScores, List<Boolean> flags) {

    public ChannelScore at(int row) {
        return new ChannelScore(zScores.get(row), flags.get(row));
    }

    public int size() {
        return zScores.size();
    }
}
