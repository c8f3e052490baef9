package com.motaz.telemetry.config;

import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.engine.config.DetectionMode;
import com.motaz.telemetry.engine.config.ScoringOrder;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * {@code telemetry.*} settings. Anything left out of {@code application.yml} falls back to the
 * defaults below.
 */
@ConfigurationProperties(prefix = "telemetry")
public record TelemetryProperties(Detection detection, Baseline baseline, Storage storage) {

    public TelemetryProperties {
        if (detection == null) {
            detection = new Detection(null, null, null, null, null, null, null, null);
        }
        if (baseline == null) {
            baseline = new Baseline(null, null);
        }
        if (storage == null) {
            storage = new Storage(null, null, null);
        }
    }

    public DetectionConfig toConfig() {
        return new DetectionConfig(detection.channels(), detection.zThreshold(), detection.contamination(),
                detection.maturityFloor(), detection.mode(), detection.scoringOrder(), detection.randomSeed(),
                detection.trees());
    }

    public record Detection(
            List<String> channels,
            Double zThreshold,
            Double contamination,
            Integer maturityFloor,
            DetectionMode mode,
            ScoringOrder scoringOrder,
            Long randomSeed,
            Integer trees
    ) {
        public static final List<String> DEFAULT_CHANNELS = List.of("temperature", "humidity", "pressure", "wind_speed");

        public Detection {
            if (channels == null || channels.isEmpty()) channels = DEFAULT_CHANNELS;
            if (zThreshold == null) zThreshold = DetectionConfig.DEFAULT_Z_THRESHOLD;
            if (contamination == null) contamination = DetectionConfig.DEFAULT_CONTAMINATION;
            if (maturityFloor == null) maturityFloor = DetectionConfig.DEFAULT_MATURITY_FLOOR;
            if (mode == null) mode = DetectionMode.BOTH;
            if (scoringOrder == null) scoringOrder = ScoringOrder.UPDATE_BEFORE_SCORE;
            if (randomSeed == null) randomSeed = DetectionConfig.DEFAULT_RANDOM_SEED;
            if (trees == null) trees = DetectionConfig.DEFAULT_TREES;
        }
    }

    public record Baseline(String key, Integer maxAttempts) {
        public Baseline {
            if (key == null || key.isBlank()) key = "state/baseline.json";
            if (maxAttempts == null) maxAttempts = 5;
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("telemetry.baseline.max-attempts must be at least 1");
            }
        }
    }

    public record Storage(String root, String rawPrefix, String processedPrefix) {
        public Storage {
            if (root == null || root.isBlank()) root = "./data";
            if (rawPrefix == null || rawPrefix.isBlank()) rawPrefix = "raw/";
            if (processedPrefix == null || processedPrefix.isBlank()) processedPrefix = "processed/";
            if (rawPrefix.equals(processedPrefix)) {
                throw new IllegalArgumentException("raw and processed prefixes must differ");
            }
        }
    }
}
