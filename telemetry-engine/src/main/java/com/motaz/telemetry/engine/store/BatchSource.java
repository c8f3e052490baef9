package com.motaz.telemetry.engine.store;

import com.motaz.telemetry.engine.model.Batch;

@FunctionalInterface
public interface BatchSource {

    Batch read(String key);
}
