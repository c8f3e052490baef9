package com.motaz.telemetry.engine.store;

import com.motaz.telemetry.engine.model.Summary;

@FunctionalInterface
public interface SummarySink {

    void put(String summaryKey, Summary summary);
}
