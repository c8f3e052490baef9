package com.motaz.telemetry.engine.exception;

import lombok.Getter;

/**
 * A non-finite reading offered to a running statistic. Only the single value is rejected.
 */
@Getter
public class InvalidValueException extends TelemetryException {

    private final double value;

    public InvalidValueException(double value) {
        super("Refusing non-finite value " + value);
        this.value = value;
    }
}
