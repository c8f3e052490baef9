package com.motaz.telemetry.engine.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Learned statistics of every channel, as loaded from the baseline store.
 *
 * <p>{@code version} is the store's optimistic-concurrency token; it is {@code null} for a table that
 * has never been stored.
 */
@ToString
@EqualsAndHashCode
public class BaselineTable {

    private final Map<String, RunningStat> channels = new LinkedHashMap<>();

    @Getter
    @Setter
    private Instant lastUpdated;

    @Getter
    @Setter
    private Long version;

    public static BaselineTable empty() {
        return new BaselineTable();
    }

    public Map<String, RunningStat> getChannels() {
        return Collections.unmodifiableMap(channels);
    }

    public Optional<RunningStat> statFor(String channel) {
        return Optional.ofNullable(channels.get(channel));
    }

    public RunningStat getOrCreate(String channel) {
        return channels.computeIfAbsent(channel, k -> new RunningStat());
    }

    public void put(String channel, RunningStat stat) {
        channels.put(channel, stat);
    }

    public long observationCount(String channel) {
        RunningStat stat = channels.get(channel);
        return stat == null ? 0L : stat.getCount();
    }

    public boolean isEmpty() {
        return channels.isEmpty();
    }
}
