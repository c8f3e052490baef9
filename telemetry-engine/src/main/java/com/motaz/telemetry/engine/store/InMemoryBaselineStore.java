package com.motaz.telemetry.engine.store;

import com.motaz.telemetry.engine.exception.BaselineConflictException;
import com.motaz.telemetry.engine.model.BaselineTable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps serialized baselines in memory. Every read decodes a fresh copy, so callers never share state.
 */
public class InMemoryBaselineStore implements BaselineStore {

    private final Map<String, Stored> storage = new ConcurrentHashMap<>();
    private final BaselineJsonCodec codec;

    public InMemoryBaselineStore() {
        this(new BaselineJsonCodec());
    }

    public InMemoryBaselineStore(BaselineJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    public Optional<BaselineTable> get(String key) {
        Stored stored = storage.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        BaselineTable table = codec.fromJson(stored.json());
        table.setVersion(stored.version());
        return Optional.of(table);
    }

    @Override
    public long put(String key, BaselineTable table) {
        Stored next = storage.compute(key, (k, current) -> {
            Long actual = current == null ? null : current.version();
            if (!Objects.equals(actual, table.getVersion())) {
                throw new BaselineConflictException(key, table.getVersion(), actual);
            }
            return new Stored(codec.toJson(table), actual == null ? 0L : actual + 1);
        });
        return next.version();
    }

    private record Stored(byte[] json, long version) {
    }
}
