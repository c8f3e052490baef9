package com.motaz.telemetry.config;

import com.motaz.telemetry.engine.config.DetectionConfig;
import com.motaz.telemetry.services.FileBatchStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class StartupConfig {

    private final FileBatchStorage fileBatchStorage;
    private final DetectionConfig detectionConfig;

    @Bean
    ApplicationRunner initApplicationRunner() {
        return args -> {
            fileBatchStorage.initialize();
            log.info("Telemetry pipeline ready: channels={} mode={} order={} zThreshold={} contamination={}",
                    detectionConfig.channels(), detectionConfig.mode(), detectionConfig.scoringOrder(),
                    detectionConfig.zThreshold(), detectionConfig.contamination());
        };
    }

}
