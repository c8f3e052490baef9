package com.motaz.telemetry.engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ScoredRow {
    BatchRow source;
    /** Per scored channel; empty when z-scores were not requested. */
    Map<String, ChannelScore> channelScores;
    /** {@code null} when the multivariate flagger did not run. */
    OutlierScore outlier;
    boolean anomaly;

    public ChannelScore channelScore(String channel) {
        return channelScores.getOrDefault(channel, ChannelScore.UNKNOWN);
    }
}
