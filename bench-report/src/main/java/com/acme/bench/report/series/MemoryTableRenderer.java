package com.acme.bench.report.series;

import com.acme.bench.report.render.MarkdownCells;
import com.acme.bench.report.util.ReportDefaults;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Lays memory series side by side: one row per string length, one column per implementation.
 */
public final class MemoryTableRenderer {
    static final String TITLE = "String Memory Comparison [bytes]";
    static final String KEY_HEADER = "Length";

    public List<String> render(List<CoordinateSeries> series) {
        Objects.requireNonNull(series, "series");
        if (series.isEmpty()) {
            return List.of();
        }
        List<CoordinateSeries> columns = new ArrayList<>(series);
        columns.sort((a, b) -> a.implementation().compareTo(b.implementation()));

        TreeSet<Double> lengths = new TreeSet<>();
        List<Map<Double, Double>> byLength = new ArrayList<>(columns.size());
        for (CoordinateSeries s : columns) {
            Map<Double, Double> values = new HashMap<>();
            for (CoordinateSeries.Point p : s.points()) {
                values.put(p.length(), p.bytes());
                lengths.add(p.length());
            }
            byLength.add(values);
        }

        int keyWidth = ReportDefaults.KEY_COLUMN_WIDTH;
        int valueWidth = ReportDefaults.VALUE_COLUMN_WIDTH;
        List<String> lines = new ArrayList<>(lengths.size() + 4);
        lines.add("### " + TITLE);

        List<String> header = new ArrayList<>();
        header.add(MarkdownCells.left(KEY_HEADER, keyWidth));
        for (CoordinateSeries s : columns) {
            header.add(MarkdownCells.center(s.implementation(), valueWidth));
        }
        lines.add(MarkdownCells.row(header));

        List<String> align = new ArrayList<>();
        align.add(MarkdownCells.left(":---", keyWidth));
        for (int i = 0; i < columns.size(); i++) {
            align.add(MarkdownCells.center("---:", valueWidth));
        }
        lines.add(MarkdownCells.row(align));

        for (double length : lengths) {
            List<String> row = new ArrayList<>();
            row.add(MarkdownCells.left(lengthLabel(length), keyWidth));
            for (Map<Double, Double> values : byLength) {
                Double v = values.get(length);
                row.add(v == null
                    ? MarkdownCells.center(ReportDefaults.MISSING_CELL, valueWidth)
                    : MarkdownCells.right(MarkdownCells.decimal(v), valueWidth));
            }
            lines.add(MarkdownCells.row(row));
        }
        lines.add("");
        return lines;
    }

    static String lengthLabel(double length) {
        if (length == Math.rint(length) && Math.abs(length) < 1e15) {
            return Long.toString((long) length);
        }
        return Double.toString(length);
    }
}
