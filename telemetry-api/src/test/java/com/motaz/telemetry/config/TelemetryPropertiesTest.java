package com.motaz.telemetry.config;

import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.engine.config.DetectionMode;
import com.motaz.telemetry.engine.config.ScoringOrder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryPropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        TelemetryProperties properties = new TelemetryProperties(null, null, null);

        DetectionConfig config = properties.toConfig();

        assertThat(config.channels()).containsExactly("temperature", "humidity", "pressure", "wind_speed");
        assertThat(config.zThreshold()).isEqualTo(3.0);
        assertThat(config.mode()).isEqualTo(DetectionMode.BOTH);
        assertThat(properties.baseline().key()).isEqualTo("state/baseline.json");
        assertThat(properties.baseline().maxAttempts()).isEqualTo(5);
        assertThat(properties.storage().rawPrefix()).isEqualTo("raw/");
        assertThat(properties.storage().processedPrefix()).isEqualTo("processed/");
    }

    @Test
    void explicitValuesAreKept() {
        TelemetryProperties properties = new TelemetryProperties(
                new TelemetryProperties.Detection(List.of("pressure"), 2.5, 0.1, 10,
                        DetectionMode.ZSCORE_ONLY, ScoringOrder.SCORE_BEFORE_UPDATE, 7L, 50),
                null, null);

        DetectionConfig config = properties.toConfig();

        assertThat(config.channels()).containsExactly("pressure");
        assertThat(config.contamination()).isEqualTo(0.1);
        assertThat(config.maturityFloor()).isEqualTo(10);
        assertThat(config.scoringOrder()).isEqualTo(ScoringOrder.SCORE_BEFORE_UPDATE);
        assertThat(config.trees()).isEqualTo(50);
    }

    @Test
    void invalidValuesFailFast() {
        TelemetryProperties badContamination = new TelemetryProperties(
                new TelemetryProperties.Detection(null, null, 1.5, null, null, null, null, null), null, null);

        assertThatThrownBy(badContamination::toConfig).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TelemetryProperties.Baseline("k", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TelemetryProperties.Storage("./data", "same/", "same/"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
