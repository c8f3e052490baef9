package com.motaz.telemetry.engine.config;

import lombok.With;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Validated detection settings, built once at startup and shared by the engine components.
 *
 * @param channels      configured channel names, de-duplicated, in configured order
 * @param zThreshold    z-score above which a reading is flagged
 * @param contamination expected anomaly proportion for the isolation forest
 * @param maturityFloor observations a channel needs before its z-scores are trusted
 * @param mode          which flaggers take part in the consensus
 * @param scoringOrder  whether a batch is scored before or after updating the baseline
 * @param randomSeed    seed for the isolation forest
 * @param trees         isolation trees per fit
 */
@With
public record DetectionConfig(List<String> channels,
                              double zThreshold,
                              double contamination,
                              int maturityFloor,
                              DetectionMode mode,
                              ScoringOrder scoringOrder,
                              long randomSeed,
                              int trees) {

    public static final double DEFAULT_Z_THRESHOLD = 3.0;
    public static final double DEFAULT_CONTAMINATION = 0.05;
    public static final int DEFAULT_MATURITY_FLOOR = 30;
    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final int DEFAULT_TREES = 100;

    public DetectionConfig {
        if (channels == null || channels.isEmpty()) {
            throw new IllegalArgumentException("at least one channel must be configured");
        }
        for (String channel : channels) {
            if (channel == null || channel.isBlank()) {
                throw new IllegalArgumentException("channel names must not be blank");
            }
        }
        channels = List.copyOf(new LinkedHashSet<>(channels.stream().map(String::trim).toList()));
        if (!(zThreshold > 0) || Double.isInfinite(zThreshold)) {
            throw new IllegalArgumentException("zThreshold must be a positive number, got " + zThreshold);
        }
        if (!(contamination > 0 && contamination < 1)) {
            throw new IllegalArgumentException("contamination must be in (0, 1), got " + contamination);
        }
        if (maturityFloor < 2) {
            throw new IllegalArgumentException("maturityFloor must be at least 2, got " + maturityFloor);
        }
        if (trees < 1) {
            throw new IllegalArgumentException("trees must be at least 1, got " + trees);
        }
        if (mode == null) {
            mode = DetectionMode.BOTH;
        }
        if (scoringOrder == null) {
            scoringOrder = ScoringOrder.UPDATE_BEFORE_SCORE;
        }
    }

    public static DetectionConfig defaults(List<String> channels) {
        return new DetectionConfig(channels, DEFAULT_Z_THRESHOLD, DEFAULT_CONTAMINATION, DEFAULT_MATURITY_FLOOR,
                DetectionMode.BOTH, ScoringOrder.UPDATE_BEFORE_SCORE, DEFAULT_RANDOM_SEED, DEFAULT_TREES);
    }
}
