package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.exception.InvalidValueException;
import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.model.ChannelSnapshot;
import com.motaz.telemetry.engine.model.RunningStat;
import com.motaz.telemetry.engine.model.UpdateResult;
import com.motaz.telemetry.engine.store.BaselineStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads, updates and saves the per-channel baseline through a {@link BaselineStore}.
 */
@Slf4j
@RequiredArgsConstructor
public class BaselineManager {

    private final BaselineStore baselineStore;
    private final Clock clock;

    /**
     * Fresh read of the stored baseline. A key that was never written yields an empty table.
     */
    public BaselineTable load(String key) {
        BaselineTable table = baselineStore.get(key).orElseGet(() -> {
            log.info("No baseline stored under {}, starting from an empty table", key);
            return BaselineTable.empty();
        });
        log.debug("Loaded baseline {} version {} with {} channels", key, table.getVersion(), table.getChannels().size());
        return table;
    }

    /**
     * Stamps {@code lastUpdated} and writes the table, advancing its version on success.
     */
    public void save(String key, BaselineTable table) {
        table.setLastUpdated(clock.instant());
        long version = baselineStore.put(key, table);
        table.setVersion(version);
        log.info("Baseline {} saved at version {}", key, version);
    }

    /**
     * Folds one batch of values into a channel in a single pass. Empty cells are skipped; non-finite
     * values are rejected one by one without stopping the rest of the channel.
     */
    public UpdateResult update(BaselineTable table, String channel, List<Double> values) {
        RunningStat stat = table.getOrCreate(channel);
        int accepted = 0;
        int rejected = 0;
        for (Double value : values) {
            if (value == null) {
                continue;
            }
            try {
                stat.update(value);
                accepted++;
            } catch (InvalidValueException e) {
                rejected++;
                log.warn("Channel '{}': {}", channel, e.getMessage());
            }
        }
        if (rejected > 0) {
            log.warn("Channel '{}': {} non-finite values rejected, {} accepted", channel, rejected, accepted);
        }
        log.debug("Channel '{}' now at count={} mean={} std={}", channel, stat.getCount(), stat.getMean(), stat.std());
        return new UpdateResult(channel, accepted, rejected);
    }

    public List<ChannelSnapshot> describe(BaselineTable table, int maturityFloor) {
        List<ChannelSnapshot> snapshots = new ArrayList<>();
        table.getChannels().forEach((channel, stat) -> snapshots.add(new ChannelSnapshot(
                channel, stat.getCount(), stat.getMean(), stat.std(), stat.isMature(maturityFloor))));
        return snapshots;
    }
}
