package com.motaz.telemetry.engine.config;

/**
 * Whether a batch is scored against the baseline before or after its own values are folded in.
 */
public enum ScoringOrder {
    /** Fold the batch into the baseline, then score it against the updated table. */
    UPDATE_BEFORE_SCORE,
    /** Score the batch against the baseline as loaded, then fold it in. */
    SCORE_BEFORE_UPDATE
}
