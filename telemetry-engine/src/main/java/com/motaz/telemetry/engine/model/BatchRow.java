package com.motaz.telemetry.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a batch: the raw cell text of every column, and the parsed reading of every channel.
 * A {@code null} reading means the cell was empty.
 */
public record BatchRow(Map<String, String> cells, Map<String, Double> readings) {

    public BatchRow {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
        readings = Collections.unmodifiableMap(new LinkedHashMap<>(readings));
    }

    public static BatchRow ofReadings(Map<String, Double> readings) {
        Map<String, String> cells = new LinkedHashMap<>();
        readings.forEach((channel, value) -> cells.put(channel, value == null ? "" : String.valueOf(value)));
        return new BatchRow(cells, readings);
    }

    public Double reading(String channel) {
        return readings.get(channel);
    }

    public String cell(String column) {
        return cells.get(column);
    }
}
