package com.motaz.telemetry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalySummaryResponseDto {
    private String message;
    private Long filesProcessed;
    private Long totalRowsScored;
    private Long totalAnomalies;
    private BigDecimal overallAnomalyRate;
    private List<BatchSummaryDto> mostRecent;
}
