package com.motaz.telemetry.engine.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum OutlierLabel {
    ANOMALY(-1),
    NORMAL(1);

    private final int code;
}
