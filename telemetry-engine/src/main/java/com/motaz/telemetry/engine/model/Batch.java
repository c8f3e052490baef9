package com.motaz.telemetry.engine.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered set of rows sharing one header.
 */
@Getter
@ToString
public class Batch {

    private final List<String> columns;
    private final List<BatchRow> rows;

    public Batch(List<String> columns, List<BatchRow> rows) {
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    /**
     * Builds a batch of channel readings only; every map becomes one row. Handy for callers that do
     * not carry any pass-through columns.
     */
    public static Batch ofReadings(List<String> columns, List<Map<String, Double>> readings) {
        List<BatchRow> rows = new ArrayList<>(readings.size());
        for (Map<String, Double> reading : readings) {
            Map<String, Double> aligned = new LinkedHashMap<>();
            for (String column : columns) {
                aligned.put(column, reading.get(column));
            }
            rows.add(BatchRow.ofReadings(aligned));
        }
        return new Batch(columns, rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** Configured channels that appear in this batch's header, in configured order. */
    public List<String> presentChannels(Collection<String> configured) {
        return configured.stream().filter(this::hasColumn).toList();
    }

    /** The channel's value in every row, {@code null} where the cell was empty. */
    public List<Double> readings(String channel) {
        List<Double> values = new ArrayList<>(rows.size());
        for (BatchRow row : rows) {
            values.add(row.reading(channel));
        }
        return values;
    }

    public List<Double> presentReadings(String channel) {
        return readings(channel).stream().filter(Objects::nonNull).toList();
    }
}
