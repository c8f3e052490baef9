package com.motaz.telemetry.engine.exception;

/**
 * Base type for every failure raised by the telemetry pipeline.
 */
public class TelemetryException extends RuntimeException {

    public TelemetryException(String message) {
        super(message);
    }

    public TelemetryException(String message, Throwable cause) {
        super(message, cause);
    }
}
