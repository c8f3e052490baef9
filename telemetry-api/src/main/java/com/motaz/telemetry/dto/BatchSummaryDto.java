package com.motaz.telemetry.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class BatchSummaryDto {
    private String sourceKey;
    private String outputKey;
    private String summaryKey;
    private Instant processedAt;
    private long totalRows;
    private long anomalyCount;
    private BigDecimal anomalyRate;
    private Map<String, Long> baselineObservationCounts;
}
