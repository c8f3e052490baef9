package com.motaz.telemetry.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "t_batch_summary", schema = "public")
public class BatchSummaryEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "batch_summary_entity_seq_generator")
    @SequenceGenerator(name = "batch_summary_entity_seq_generator", sequenceName = "batch_summary_id_seq", allocationSize = 50)
    private Long id;

    @Column(name = "summary_key", nullable = false, unique = true, length = 512)
    private String summaryKey;

    @Column(name = "source_key", nullable = false, length = 512)
    private String sourceKey;

    @Column(name = "output_key", nullable = false, length = 512)
    private String outputKey;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Column(name = "total_rows", nullable = false)
    private Long totalRows;

    @Column(name = "anomaly_count", nullable = false)
    private Long anomalyCount;

    @Column(name = "anomaly_rate", nullable = false, precision = 6, scale = 4)
    private BigDecimal anomalyRate;

    @Column(name = "baseline_counts", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Long> baselineCounts;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    private void setCreatedAt() {
        this.createdAt = Instant.now();
    }

}
