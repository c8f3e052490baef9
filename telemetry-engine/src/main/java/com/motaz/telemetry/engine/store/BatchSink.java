package com.motaz.telemetry.engine.store;

import com.motaz.telemetry.engine.model.ScoredBatch;

@FunctionalInterface
public interface BatchSink {

    void put(String outputKey, ScoredBatch scoredBatch);
}
