package com.motaz.telemetry.engine.config;

public enum DetectionMode {
    ZSCORE_ONLY,
    MULTIVARIATE_ONLY,
    BOTH;

    public boolean usesZScore() {
        return this != MULTIVARIATE_ONLY;
    }

    public boolean usesMultivariate() {
        return this != ZSCORE_ONLY;
    }
}
