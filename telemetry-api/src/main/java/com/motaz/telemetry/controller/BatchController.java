package com.motaz.telemetry.controller;

import com.motaz.telemetry.dto.BatchSummaryDto;
import com.motaz.telemetry.engine.model.Summary;
import com.motaz.telemetry.engine.service.BatchProcessor;
import com.motaz.telemetry.services.FileBatchStorage;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/v1/batches")
@RequiredArgsConstructor
public class BatchController {
    private final BatchProcessor batchProcessor;
    private final FileBatchStorage fileBatchStorage;

    @PostMapping("/process")
    public BatchSummaryDto process(
            @Parameter(description = "Storage key of a raw CSV batch", required = true, example = "raw/sensors_20240601.csv")
            @RequestParam(name = "key") String key) {
        return toDto(batchProcessor.process(key));
    }

    @PostMapping(path = "/upload/{fileName}", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_OCTET_STREAM_VALUE})
    public BatchSummaryDto upload(
            @Parameter(description = "Name to store the CSV under in the raw area", required = true, example = "sensors_20240601.csv")
            @PathVariable(name = "fileName") String fileName,
            @RequestBody byte[] content) {
        String key = fileBatchStorage.storeRaw(fileName, content);
        return toDto(batchProcessor.process(key));
    }

    private static BatchSummaryDto toDto(Summary summary) {
        return BatchSummaryDto.builder()
                .sourceKey(summary.sourceKey())
                .outputKey(summary.outputKey())
                .summaryKey(summary.summaryKey())
                .processedAt(summary.processedAt())
                .totalRows(summary.totalRows())
                .anomalyCount(summary.anomalyCount())
                .anomalyRate(BigDecimal.valueOf(summary.anomalyRate()))
                .baselineObservationCounts(summary.baselineObservationCounts())
                .build();
    }
}
