package com.motaz.telemetry.services;

import com.motaz.telemetry.dto.AnomalySummaryResponseDto;
import com.motaz.telemetry.dto.BatchSummaryDto;
import com.motaz.telemetry.engine.exception.StoreUnavailableException;
import com.motaz.telemetry.engine.model.Summary;
import com.motaz.telemetry.engine.store.SummarySink;
import com.motaz.telemetry.model.entities.BatchSummaryEntity;
import com.motaz.telemetry.repositories.BatchSummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class BatchSummaryService implements SummarySink {

    private final BatchSummaryRepository batchSummaryRepository;

    /**
     * Saves the summary, replacing an earlier one under the same key so a retried batch leaves a
     * single record.
     */
    @Override
    @Transactional
    public void put(String summaryKey, Summary summary) {
        try {
            BatchSummaryEntity entity = batchSummaryRepository.findBySummaryKey(summaryKey)
                    .orElseGet(BatchSummaryEntity::new);
            entity.setSummaryKey(summaryKey);
            entity.setSourceKey(summary.sourceKey());
            entity.setOutputKey(summary.outputKey());
            entity.setProcessedAt(summary.processedAt());
            entity.setTotalRows((long) summary.totalRows());
            entity.setAnomalyCount(summary.anomalyCount());
            entity.setAnomalyRate(BigDecimal.valueOf(summary.anomalyRate()));
            entity.setBaselineCounts(summary.baselineObservationCounts());
            batchSummaryRepository.saveAndFlush(entity);
            log.info("Summary {} saved: {}/{} anomalies (rate {})", summaryKey, summary.anomalyCount(),
                    summary.totalRows(), summary.anomalyRate());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Could not save summary " + summaryKey, e);
        }
    }

    @Transactional(readOnly = true)
    public AnomalySummaryResponseDto aggregate() {
        long files = batchSummaryRepository.count();
        if (files == 0) {
            return AnomalySummaryResponseDto.builder().message("No processed files yet.").build();
        }
        long totalRows = batchSummaryRepository.sumTotalRows();
        long totalAnomalies = batchSummaryRepository.sumAnomalyCount();
        List<BatchSummaryDto> mostRecent = batchSummaryRepository.findTop5ByOrderByProcessedAtDesc().stream()
                .map(BatchSummaryService::toDto)
                .toList();
        return AnomalySummaryResponseDto.builder()
                .filesProcessed(files)
                .totalRowsScored(totalRows)
                .totalAnomalies(totalAnomalies)
                .overallAnomalyRate(BigDecimal.valueOf(Summary.rate(totalAnomalies, totalRows)))
                .mostRecent(mostRecent)
                .build();
    }

    static BatchSummaryDto toDto(BatchSummaryEntity entity) {
        return BatchSummaryDto.builder()
                .sourceKey(entity.getSourceKey())
                .outputKey(entity.getOutputKey())
                .summaryKey(entity.getSummaryKey())
                .processedAt(entity.getProcessedAt())
                .totalRows(entity.getTotalRows())
                .anomalyCount(entity.getAnomalyCount())
                .anomalyRate(entity.getAnomalyRate())
                .baselineObservationCounts(entity.getBaselineCounts())
                .build();
    }
}
