package com.motaz.telemetry.dto;

import java.util.Map;

public record ErrorResponseDto(String code, String message, Map<String, Object> details) {
}
