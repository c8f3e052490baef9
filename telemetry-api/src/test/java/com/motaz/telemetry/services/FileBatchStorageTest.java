package com.motaz.telemetry.services;

import com.motaz.telemetry.config.TelemetryProperties;
import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.engine.exception.BatchNotFoundException;
import com.motaz.telemetry.engine.model.Batch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileBatchStorageTest {

    @TempDir
    Path root;

    FileBatchStorage storage;

    @BeforeEach
    void setUp() {
        TelemetryProperties properties = new TelemetryProperties(null, null,
                new TelemetryProperties.Storage(root.toString(), null, null));
        storage = new FileBatchStorage(properties, new CsvBatchCodec(),
                DetectionConfig.defaults(List.of("temperature")));
        storage.initialize();
    }

    @Test
    void createsRawAndProcessedAreas() {
        assertThat(root.resolve("raw")).isDirectory();
        assertThat(root.resolve("processed")).isDirectory();
    }

    @Test
    void readsStoredUpload() {
        String key = storage.storeRaw("sensors.csv", "temperature\n21.5\n".getBytes(StandardCharsets.UTF_8));

        Batch batch = storage.read(key);

        assertThat(key).isEqualTo("raw/sensors.csv");
        assertThat(batch.readings("temperature")).containsExactly(21.5);
    }

    @Test
    void missingFileIsNotFound() {
        assertThatThrownBy(() -> storage.read("raw/nope.csv")).isInstanceOf(BatchNotFoundException.class);
    }

    @Test
    void rejectsKeysOutsideTheRoot() {
        assertThatThrownBy(() -> storage.read("../outside.csv")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.storeRaw("../x.csv", new byte[0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.storeRaw("x.txt", new byte[0])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listsProcessedCsvsNewestNameFirst() throws Exception {
        Files.writeString(root.resolve("processed/sensors_20240101.csv"), "a\n1\n");
        Files.writeString(root.resolve("processed/sensors_20240301.csv"), "a\n1\n");
        Files.writeString(root.resolve("processed/sensors_20240301_summary.json"), "{}");

        assertThat(storage.listProcessed())
                .containsExactly("processed/sensors_20240301.csv", "processed/sensors_20240101.csv");
    }
}
