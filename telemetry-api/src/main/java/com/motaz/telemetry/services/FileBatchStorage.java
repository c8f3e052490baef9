package com.motaz.telemetry.services;

import com.motaz.telemetry.config.TelemetryProperties;
import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.engine.exception.BatchNotFoundException;
import com.motaz.telemetry.engine.exception.StoreUnavailableException;
import com.motaz.telemetry.engine.model.Batch;
import com.motaz.telemetry.engine.model.ScoredBatch;
import com.motaz.telemetry.engine.store.BatchSink;
import com.motaz.telemetry.engine.store.BatchSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Raw and processed CSVs on the local file system. Keys are paths relative to the storage root,
 * e.g. {@code raw/sensors.csv}.
 */
@Slf4j
@Service
public class FileBatchStorage implements BatchSource, BatchSink {

    @Getter
    private final Path root;
    private final String rawPrefix;
    private final String processedPrefix;
    private final CsvBatchCodec csvBatchCodec;
    private final DetectionConfig detectionConfig;

    public FileBatchStorage(TelemetryProperties properties, CsvBatchCodec csvBatchCodec, DetectionConfig detectionConfig) {
        this.root = Path.of(properties.storage().root()).toAbsolutePath().normalize();
        this.rawPrefix = properties.storage().rawPrefix();
        this.processedPrefix = properties.storage().processedPrefix();
        this.csvBatchCodec = csvBatchCodec;
        this.detectionConfig = detectionConfig;
    }

    public void initialize() {
        try {
            Files.createDirectories(resolve(rawPrefix));
            Files.createDirectories(resolve(processedPrefix));
            log.info("Batch storage rooted at {}", root);
        } catch (IOException e) {
            throw new StoreUnavailableException("Could not create storage directories under " + root, e);
        }
    }

    @Override
    public Batch read(String key) {
        Path path = resolve(key);
        try {
            return csvBatchCodec.decode(Files.readAllBytes(path), detectionConfig.channels());
        } catch (NoSuchFileException e) {
            throw new BatchNotFoundException(key);
        } catch (IOException e) {
            throw new StoreUnavailableException("Could not read " + key, e);
        }
    }

    @Override
    public void put(String outputKey, ScoredBatch scoredBatch) {
        write(outputKey, csvBatchCodec.encode(scoredBatch));
        log.info("Wrote {} scored rows to {}", scoredBatch.totalRows(), outputKey);
    }

    /**
     * Stores an uploaded CSV under the raw prefix and returns its key.
     */
    public String storeRaw(String fileName, byte[] content) {
        if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")
                || fileName.startsWith(".")) {
            throw new IllegalArgumentException("Invalid file name: " + fileName);
        }
        if (!fileName.endsWith(".csv")) {
            throw new IllegalArgumentException("Only .csv uploads are accepted, got " + fileName);
        }
        String key = rawPrefix + fileName;
        write(key, content);
        log.info("Stored upload {} ({} bytes)", key, content.length);
        return key;
    }

    /**
     * Keys of processed CSVs, newest name first.
     */
    public List<String> listProcessed() {
        Path dir = resolve(processedPrefix);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".csv"))
                    .map(path -> root.relativize(path).toString().replace('\\', '/'))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (IOException e) {
            throw new StoreUnavailableException("Could not list " + processedPrefix, e);
        }
    }

    public CsvBatchCodec.CsvTable readTable(String key) {
        Path path = resolve(key);
        try {
            return csvBatchCodec.parse(Files.readString(path));
        } catch (NoSuchFileException e) {
            throw new BatchNotFoundException(key);
        } catch (IOException e) {
            throw new StoreUnavailableException("Could not read " + key, e);
        }
    }

    private void write(String key, byte[] content) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StoreUnavailableException("Could not write " + key, e);
        }
    }

    Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Key escapes the storage root: " + key);
        }
        return path;
    }
}
