package com.motaz.telemetry.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "t_channel_baseline", schema = "public")
public class BaselineSnapshotEntity {

    @Id
    @Column(name = "id", nullable = false, length = 255)
    private String id;

    @Column(name = "document", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> document;

    @Column(name = "last_updated")
    private Instant lastUpdated;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

}
