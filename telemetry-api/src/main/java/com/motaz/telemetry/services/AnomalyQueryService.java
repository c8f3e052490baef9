package com.motaz.telemetry.services;

import com.motaz.telemetry.config.TelemetryProperties;
import com.motaz.telemetry.dto.BaselineChannelDto;
import com.motaz.telemetry.dto.BaselineResponseDto;
import com.motaz.telemetry.dto.RecentAnomaliesResponseDto;
import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.engine.model.BaselineTable;
import com.motaz.telemetry.engine.model.ChannelSnapshot;
import com.motaz.telemetry.engine.service.BaselineManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views over processed output and the current baseline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyQueryService {

    static final int RECENT_FILES = 10;
    static final String SOURCE_FILE_COLUMN = "source_file";

    private final FileBatchStorage fileBatchStorage;
    private final BaselineManager baselineManager;
    private final DetectionConfig detectionConfig;
    private final TelemetryProperties telemetryProperties;

    public RecentAnomaliesResponseDto recentAnomalies(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        List<Map<String, String>> anomalies = new ArrayList<>();
        List<String> keys = fileBatchStorage.listProcessed();
        for (String key : keys.subList(0, Math.min(RECENT_FILES, keys.size()))) {
            CsvBatchCodec.CsvTable table = fileBatchStorage.readTable(key);
            if (!table.header().contains(CsvBatchCodec.ANOMALY_COLUMN)) {
                log.debug("{} has no {} column, skipped", key, CsvBatchCodec.ANOMALY_COLUMN);
                continue;
            }
            for (Map<String, String> record : table.records()) {
                if (Boolean.parseBoolean(record.get(CsvBatchCodec.ANOMALY_COLUMN))) {
                    Map<String, String> tagged = new LinkedHashMap<>(record);
                    tagged.put(SOURCE_FILE_COLUMN, key);
                    anomalies.add(tagged);
                }
            }
        }
        List<Map<String, String>> limited = anomalies.subList(0, Math.min(limit, anomalies.size()));
        return RecentAnomaliesResponseDto.builder()
                .count(limited.size())
                .anomalies(List.copyOf(limited))
                .build();
    }

    public BaselineResponseDto currentBaseline() {
        BaselineTable table = baselineManager.load(telemetryProperties.baseline().key());
        Map<String, BaselineChannelDto> channels = new LinkedHashMap<>();
        for (ChannelSnapshot snapshot : baselineManager.describe(table, detectionConfig.maturityFloor())) {
            channels.put(snapshot.channel(), BaselineChannelDto.builder()
                    .observations(snapshot.observations())
                    .mean(round(snapshot.mean()))
                    .std(round(snapshot.std()))
                    .baselineMature(snapshot.mature())
                    .build());
        }
        return BaselineResponseDto.builder()
                .lastUpdated(table.getLastUpdated())
                .channels(channels)
                .build();
    }

    private static BigDecimal round(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }
}
