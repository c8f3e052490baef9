package com.motaz.telemetry.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class BaselineChannelDto {
    private long observations;
    private BigDecimal mean;
    private BigDecimal std;
    private boolean baselineMature;
}
