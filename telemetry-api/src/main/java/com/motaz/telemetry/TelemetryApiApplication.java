package com.motaz.telemetry;

import com.motaz.telemetry.config.TelemetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;


@SpringBootApplication
@EnableConfigurationProperties(TelemetryProperties.class)
public class TelemetryApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelemetryApiApplication.class, args);
    }

}
