package com.motaz.telemetry.engine.exception;

/**
 * I/O failure at a store or sink. The batch attempt fails as a whole and may be retried.
 */
public class StoreUnavailableException extends TelemetryException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
