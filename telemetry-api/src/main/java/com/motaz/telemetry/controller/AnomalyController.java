package com.motaz.telemetry.controller;

import com.motaz.telemetry.dto.AnomalySummaryResponseDto;
import com.motaz.telemetry.dto.BaselineResponseDto;
import com.motaz.telemetry.dto.RecentAnomaliesResponseDto;
import com.motaz.telemetry.services.AnomalyQueryService;
import com.motaz.telemetry.services.BatchSummaryService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnomalyController {
    private final AnomalyQueryService anomalyQueryService;
    private final BatchSummaryService batchSummaryService;

    @GetMapping("/anomalies/recent")
    public RecentAnomaliesResponseDto getRecentAnomalies(
            @Parameter(description = "Maximum number of anomalous rows to return", example = "50")
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return anomalyQueryService.recentAnomalies(limit);
    }

    @GetMapping("/anomalies/summary")
    public AnomalySummaryResponseDto getAnomalySummary() {
        return batchSummaryService.aggregate();
    }

    @GetMapping("/baseline/current")
    public BaselineResponseDto getCurrentBaseline() {
        return anomalyQueryService.currentBaseline();
    }
}
