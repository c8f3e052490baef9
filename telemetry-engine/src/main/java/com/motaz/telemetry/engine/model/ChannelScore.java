package com.motaz.telemetry.engine.model;

/**
 * Z-score test outcome for one cell. Both fields are {@code null} when the result is unknown
 * (immature baseline or empty cell).
 */
public record ChannelScore(Double zScore, Boolean flag) {

    public static final ChannelScore UNKNOWN = new ChannelScore(null, null);

    public boolean isFlagged() {
        return Boolean.TRUE.equals(flag);
    }
}
