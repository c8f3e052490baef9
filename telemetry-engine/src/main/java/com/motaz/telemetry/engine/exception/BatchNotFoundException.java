package com.motaz.telemetry.engine.exception;

import lombok.Getter;

@Getter
public class BatchNotFoundException extends TelemetryException {

    private final String key;

    public BatchNotFoundException(String key) {
        super("No batch stored under " + key);
        this.key = key;
    }
}
