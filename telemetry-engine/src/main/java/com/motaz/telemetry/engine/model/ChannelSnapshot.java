package com.motaz.telemetry.engine.model;

public record ChannelSnapshot(String channel, long observations, double mean, double std, boolean mature) {
}
