package com.motaz.telemetry.repositories;

import com.motaz.telemetry.model.entities.BaselineSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BaselineSnapshotRepository extends JpaRepository<BaselineSnapshotEntity, String> {
}
