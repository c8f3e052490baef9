package com.motaz.telemetry.services;

import com.motaz.telemetry.engine.exception.BaselineConflictException;
import com.motaz.telemetry.engine.exception.StoreUnavailableException;
import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.store.BaselineJsonCodec;
import com.motaz.telemetry.engine.store.BaselineStore;
import com.motaz.telemetry.model.entities.BaselineSnapshotEntity;
import com.motaz.telemetry.repositories.BaselineSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Baseline documents in {@code t_channel_baseline}, one row per key. The row's {@code @Version}
 * column is the optimistic token handed out with every read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaBaselineStore implements BaselineStore {

    private final BaselineSnapshotRepository baselineSnapshotRepository;
    private final BaselineJsonCodec baselineJsonCodec;

    @Override
    @Transactional(readOnly = true)
    public Optional<BaselineTable> get(String key) {
        try {
            return baselineSnapshotRepository.findById(key).map(entity -> {
                BaselineTable table = baselineJsonCodec.fromDocument(entity.getDocument());
                table.setVersion(entity.getVersion());
                return table;
            });
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Could not read baseline " + key, e);
        }
    }

    @Override
    @Transactional
    public long put(String key, BaselineTable table) {
        Long expected = table.getVersion();
        try {
            Optional<BaselineSnapshotEntity> existing = baselineSnapshotRepository.findById(key);
            Long actual = existing.map(BaselineSnapshotEntity::getVersion).orElse(null);
            if (!Objects.equals(expected, actual)) {
                throw new BaselineConflictException(key, expected, actual);
            }
            BaselineSnapshotEntity entity = existing.orElseGet(() -> {
                BaselineSnapshotEntity created = new BaselineSnapshotEntity();
                created.setId(key);
                return created;
            });
            entity.setDocument(baselineJsonCodec.toDocument(table));
            entity.setLastUpdated(table.getLastUpdated());
            BaselineSnapshotEntity saved = baselineSnapshotRepository.saveAndFlush(entity);
            log.debug("Stored baseline {} at version {}", key, saved.getVersion());
            return saved.getVersion();
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new BaselineConflictException(key, expected, e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Could not write baseline " + key, e);
        }
    }
}
