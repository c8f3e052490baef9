package com.motaz.telemetry.engine.model;

import java.util.List;

public record MultivariateResult(List<OutlierLabel> labels, double[] scores) {

    public OutlierScore at(int row) {
        return new OutlierScore(labels.get(row), scores[row]);
    }

    public long flaggedCount() {
        return labels.stream().filter(label -> label == OutlierLabel.ANOMALY).count();
    }

    public int size() {
        return labels.size();
    }
}
