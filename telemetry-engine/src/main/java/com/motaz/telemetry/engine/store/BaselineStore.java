package com.motaz.telemetry.engine.store;

import com.motaz.telemetry.engine.exception.BaselineConflictException;
import com.motaz.telemetry.engine.exception.StoreUnavailableException;
import com.motaz.telemetry.engine.model.BaselineTable;

import java.util.Optional;

/**
 * Durable home of the shared baseline. The store is the only source of truth across processes.
 *
 * <p>Writes are optimistic: {@link #put} succeeds only if the stored version still equals
 * {@link BaselineTable#getVersion()} (or nothing is stored and the table's version is {@code null}).
 */
public interface BaselineStore {

    /**
     * @return the stored table with its version set, or empty when nothing has been stored under the key
     * @throws StoreUnavailableException on I/O failure
     */
    Optional<BaselineTable> get(String key);

    /**
     * @return the version now stored under the key
     * @throws BaselineConflictException if the stored version moved since the table was loaded
     * @throws StoreUnavailableException on I/O failure
     */
    long put(String key, BaselineTable table);
}
