package com.motaz.telemetry.engine.model;

/**
 * Outcome of folding one batch of values into a channel.
 */
public record UpdateResult(String channel, int accepted, int rejected) {
}
