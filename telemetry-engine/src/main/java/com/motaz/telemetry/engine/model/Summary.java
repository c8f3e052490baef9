package com.motaz.telemetry.engine.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Processing record for one batch. Created once, never modified.
 */
@Builder
public record Summary(String sourceKey,
                      String outputKey,
                      String summaryKey,
                      Instant processedAt,
                      int totalRows,
                      long anomalyCount,
                      double anomalyRate,
                      Map<String, Long> baselineObservationCounts) {

    public Summary {
        baselineObservationCounts = baselineObservationCounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(baselineObservationCounts));
    }

    public static Summary of(String sourceKey, String outputKey, String summaryKey, Instant processedAt,
                             ScoredBatch scored, BaselineTable baseline, Collection<String> channels) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String channel : channels) {
            counts.put(channel, baseline.observationCount(channel));
        }
        long anomalies = scored.anomalyCount();
        return Summary.builder()
                .sourceKey(sourceKey)
                .outputKey(outputKey)
                .summaryKey(summaryKey)
                .processedAt(processedAt)
                .totalRows(scored.totalRows())
                .anomalyCount(anomalies)
                .anomalyRate(rate(anomalies, scored.totalRows()))
                .baselineObservationCounts(counts)
                .build();
    }

    /** {@code anomalies / total} to four decimals; zero for an empty batch. */
    public static double rate(long anomalies, long total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(anomalies)
                .divide(BigDecimal.valueOf(total), 4, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
