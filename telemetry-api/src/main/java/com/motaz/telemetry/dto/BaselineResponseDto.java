package com.motaz.telemetry.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class BaselineResponseDto {
    private Instant lastUpdated;
    private Map<String, BaselineChannelDto> channels;
}
