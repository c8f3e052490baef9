package com.motaz.telemetry.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class RecentAnomaliesResponseDto {
    private int count;
    private List<Map<String, String>> anomalies;
}
