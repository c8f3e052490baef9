package com.motaz.telemetry.engine.exception;

/**
 * The batch cannot be scored as delivered. Raised before the baseline is touched.
 */
public class MalformedBatchException extends TelemetryException {

    public MalformedBatchException(String message) {
        super(message);
    }

    public MalformedBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
