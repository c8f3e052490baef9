package com.motaz.telemetry.engine.model;

import com.motaz.telemetry.engine.config.DetectionMode;
import lombok.Getter;

import java.util.List;

/**
 * A batch together with the output of every flagger and the consensus decision per row.
 */
@Getter
public class ScoredBatch {

    private final Batch batch;
    private final DetectionMode mode;
    /** Channels that received z-score columns, in configured order. */
    private final List<String> scoredChannels;
    private final List<ScoredRow> rows;

    public ScoredBatch(Batch batch, DetectionMode mode, List<String> scoredChannels, List<ScoredRow> rows) {
        this.batch = batch;
        this.mode = mode;
        this.scoredChannels = List.copyOf(scoredChannels);
        this.rows = List.copyOf(rows);
    }

    public int totalRows() {
        return rows.size();
    }

    public long anomalyCount() {
        return rows.stream().filter(ScoredRow::isAnomaly).count();
    }

    public boolean hasOutlierColumns() {
        return mode.usesMultivariate();
    }
}
