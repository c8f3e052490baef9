package com.motaz.telemetry.engine.model;

/**
 * Multivariate outcome for one row. Lower scores are stronger outliers; negative scores are labelled
 * {@link OutlierLabel#ANOMALY}.
 */
public record OutlierScore(OutlierLabel label, double score) {

    public boolean flag() {
        return label == OutlierLabel.ANOMALY;
    }
}
