package com.motaz.telemetry.repositories;

import com.motaz.telemetry.model.entities.BatchSummaryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BatchSummaryRepository extends JpaRepository<BatchSummaryEntity, Long> {

    Optional<BatchSummaryEntity> findBySummaryKey(String summaryKey);

    List<BatchSummaryEntity> findTop5ByOrderByProcessedAtDesc();

    @Query("select coalesce(sum(s.totalRows), 0L) from BatchSummaryEntity s")
    long sumTotalRows();

    @Query("select coalesce(sum(s.anomalyCount), 0L) from BatchSummaryEntity s")
    long sumAnomalyCount();
}
