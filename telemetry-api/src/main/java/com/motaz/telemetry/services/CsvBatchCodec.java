package com.motaz.telemetry.services;

import com.motaz.telemetry.engine.exception.MalformedBatchException;
import com.motaz.telemetry.engine.model.Batch;
import com.motaz.telemetry.engine.model.BatchRow;
import com.motaz.telemetry.engine.model.ChannelScore;
import com.motaz.telemetry.engine.model.OutlierScore;
import com.motaz.telemetry.engine.model.ScoredBatch;
import com.motaz.telemetry.engine.model.ScoredRow;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads sensor CSVs into {@link Batch}es and writes scored batches back out.
 *
 * <p>Cells are comma separated with optional double quotes ({@code ""} escapes a quote inside a quoted
 * cell). Channel cells that are empty or read {@code NA}, {@code N/A}, {@code null} or {@code None}
 * are missing readings; {@code nan} and {@code inf} are kept as non-finite values.
 */
@Component
public class CsvBatchCodec {

    public static final String ANOMALY_COLUMN = "anomaly";

    private static final Set<String> NULL_TOKENS = Set.of("", "na", "n/a", "null", "none");

    public Batch decode(byte[] content, Collection<String> channels) {
        CsvTable table = parse(new String(content, StandardCharsets.UTF_8));
        List<String> header = table.header();
        List<BatchRow> rows = new ArrayList<>(table.rows().size());
        for (int r = 0; r < table.rows().size(); r++) {
            List<String> cells = table.rows().get(r);
            if (cells.size() != header.size()) {
                throw new MalformedBatchException("Row " + (r + 1) + " has " + cells.size()
                        + " cells, header has " + header.size());
            }
            Map<String, String> byColumn = new LinkedHashMap<>();
            Map<String, Double> readings = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                String column = header.get(c);
                byColumn.put(column, cells.get(c));
                if (channels.contains(column)) {
                    readings.put(column, parseReading(cells.get(c), r + 1, column));
                }
            }
            rows.add(new BatchRow(byColumn, readings));
        }
        return new Batch(header, rows);
    }

    public byte[] encode(ScoredBatch scored) {
        List<String> header = new ArrayList<>(scored.getBatch().getColumns());
        for (String channel : scored.getScoredChannels()) {
            header.add(channel + "_zscore");
            header.add(channel + "_zscore_flag");
        }
        if (scored.hasOutlierColumns()) {
            header.add("if_label");
            header.add("if_score");
            header.add("if_flag");
        }
        header.add(ANOMALY_COLUMN);

        StringBuilder sb = new StringBuilder();
        appendLine(sb, header);
        for (ScoredRow row : scored.getRows()) {
            List<String> cells = new ArrayList<>(header.size());
            for (String column : scored.getBatch().getColumns()) {
                String cell = row.getSource().cell(column);
                cells.add(cell == null ? "" : cell);
            }
            for (String channel : scored.getScoredChannels()) {
                ChannelScore score = row.channelScore(channel);
                cells.add(score.zScore() == null ? "" : decimal(score.zScore()));
                cells.add(score.flag() == null ? "" : score.flag().toString());
            }
            if (scored.hasOutlierColumns()) {
                OutlierScore outlier = row.getOutlier();
                cells.add(String.valueOf(outlier.label().getCode()));
                cells.add(decimal(outlier.score()));
                cells.add(String.valueOf(outlier.flag()));
            }
            cells.add(String.valueOf(row.isAnomaly()));
            appendLine(sb, cells);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Splits CSV text into a header and rows of raw cells. Blank lines are skipped.
     */
    public CsvTable parse(String text) {
        List<List<String>> lines = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        boolean lineHasContent = false;
        int i = text.startsWith("\uFEFF") ? 1 : 0;
        for (; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(ch);
                }
                continue;
            }
            switch (ch) {
                case '"' -> {
                    quoted = true;
                    lineHasContent = true;
                }
                case ',' -> {
                    current.add(cell.toString());
                    cell.setLength(0);
                    lineHasContent = true;
                }
                case '\r' -> {
                    // handled with the following \n
                }
                case '\n' -> {
                    if (lineHasContent || cell.length() > 0) {
                        current.add(cell.toString());
                        lines.add(current);
                    }
                    current = new ArrayList<>();
                    cell.setLength(0);
                    lineHasContent = false;
                }
                default -> {
                    cell.append(ch);
                    lineHasContent = true;
                }
            }
        }
        if (quoted) {
            throw new MalformedBatchException("Unterminated quoted cell at end of input");
        }
        if (lineHasContent || cell.length() > 0) {
            current.add(cell.toString());
            lines.add(current);
        }
        if (lines.isEmpty()) {
            throw new MalformedBatchException("CSV has no header row");
        }
        List<String> header = lines.get(0).stream().map(String::trim).toList();
        if (header.stream().anyMatch(String::isEmpty)) {
            throw new MalformedBatchException("CSV header has an empty column name: " + header);
        }
        if (new HashSet<>(header).size() != header.size()) {
            throw new MalformedBatchException("CSV header repeats a column name: " + header);
        }
        return new CsvTable(header, lines.subList(1, lines.size()));
    }

    static Double parseReading(String cell, int row, String column) {
        String value = cell.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (NULL_TOKENS.contains(lower)) {
            return null;
        }
        switch (lower) {
            case "nan", "+nan", "-nan":
                return Double.NaN;
            case "inf", "+inf", "infinity", "+infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf", "-infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedBatchException("Row " + row + ", column '" + column + "': '" + cell
                    + "' is not a number", e);
        }
    }

    private static String decimal(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static void appendLine(StringBuilder sb, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(cells.get(i)));
        }
        sb.append('\n');
    }

    private static String escape(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }

    public record CsvTable(List<String> header, List<List<String>> rows) {

        /** Rows as column-to-cell maps, for callers that look cells up by name. */
        public List<Map<String, String>> records() {
            List<Map<String, String>> records = new ArrayList<>(rows.size());
            for (List<String> row : rows) {
                Map<String, String> record = new LinkedHashMap<>();
                for (int c = 0; c < header.size(); c++) {
                    record.put(header.get(c), c < row.size() ? row.get(c) : "");
                }
                records.add(record);
            }
            return records;
        }
    }
}
