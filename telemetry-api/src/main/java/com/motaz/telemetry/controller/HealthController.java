package com.motaz.telemetry.controller;

import com.motaz.telemetry.services.FileBatchStorage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {
    private final FileBatchStorage fileBatchStorage;
    private final Clock clock;

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of(
                "status", "ok",
                "storageRoot", fileBatchStorage.getRoot().toString(),
                "timestamp", clock.instant().toString());
    }
}
