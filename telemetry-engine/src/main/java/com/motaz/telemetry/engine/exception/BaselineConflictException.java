package com.motaz.telemetry.engine.exception;

import lombok.Getter;

/**
 * The baseline was saved by someone else between our load and our save.
 */
@Getter
public class BaselineConflictException extends TelemetryException {

    private final String key;
    private final Long expectedVersion;
    private final Long actualVersion;

    public BaselineConflictException(String key, Long expectedVersion, Long actualVersion) {
        super("Baseline " + key + " changed concurrently (expected version " + expectedVersion
                + ", found " + actualVersion + ")");
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public BaselineConflictException(String key, Long expectedVersion, Throwable cause) {
        super("Baseline " + key + " changed concurrently (expected version " + expectedVersion + ")", cause);
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = null;
    }
}
