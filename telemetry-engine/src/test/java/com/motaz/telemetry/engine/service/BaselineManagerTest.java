package com.motaz.telemetry.engine.service;

import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.model.ChannelSnapshot;
import com.motaz.telemetry.engine.model.UpdateResult;
import com.motaz.telemetry.engine.store.InMemoryBaselineStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BaselineManagerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private InMemoryBaselineStore store;
    private BaselineManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryBaselineStore();
        manager = new BaselineManager(store, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void loadsEmptyTableWhenNothingStored() {
        BaselineTable table = manager.load("baseline/stats.json");

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.getVersion()).isNull();
    }

    @Test
    void updateSkipsEmptyCellsAndRejectsNonFiniteValues() {
        BaselineTable table = BaselineTable.empty();

        UpdateResult result = manager.update(table, "temperature",
                Arrays.asList(20.0, null, Double.NaN, 22.0, Double.POSITIVE_INFINITY, 24.0));

        assertThat(result.accepted()).isEqualTo(3);
        assertThat(result.rejected()).isEqualTo(2);
        assertThat(table.observationCount("temperature")).isEqualTo(3);
        assertThat(table.statFor("temperature").orElseThrow().getMean()).isEqualTo(22.0);
    }

    @Test
    void saveStampsTimeAndVersion() {
        BaselineTable table = manager.load("k");
        manager.update(table, "pressure", List.of(1013.0, 1012.0));

        manager.save("k", table);

        assertThat(table.getVersion()).isZero();
        BaselineTable reloaded = manager.load("k");
        assertThat(reloaded.getLastUpdated()).isEqualTo(NOW);
        assertThat(reloaded.observationCount("pressure")).isEqualTo(2);
    }

    @Test
    void describeReportsMaturity() {
        BaselineTable table = BaselineTable.empty();
        manager.update(table, "temperature", List.of(1.0, 2.0, 3.0));
        manager.update(table, "humidity", List.of(5.0));

        List<ChannelSnapshot> snapshots = manager.describe(table, 3);

        assertThat(snapshots).extracting(ChannelSnapshot::channel).containsExactly("temperature", "humidity");
        assertThat(snapshots.get(0).mature()).isTrue();
        assertThat(snapshots.get(1).mature()).isFalse();
        assertThat(snapshots.get(1).std()).isZero();
    }
}
