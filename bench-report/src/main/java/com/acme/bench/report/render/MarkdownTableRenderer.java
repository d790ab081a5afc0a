package com.acme.bench.report.render;

import com.acme.bench.report.matrix.ResultMatrix;
import com.acme.bench.report.scan.LengthRange;
import com.acme.bench.report.util.ReportDefaults;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Projects a {@link ResultMatrix} onto one markdown table per {@link TableSpec}.
 * <p>
 * Layout: a {@code ###} title, a header row of range labels, an alignment row, one row per
 * implementation, then a blank line. A {@link TableSpec} that selects no range renders to no lines at all.
 */
public final class MarkdownTableRenderer {
    static final String KEY_HEADER = "Crate";
    static final String KEY_ALIGN = ":---";
    static final String VALUE_ALIGN = ":---:";

    private final int keyWidth;
    private final int valueWidth;

    public MarkdownTableRenderer() {
        this(ReportDefaults.KEY_COLUMN_WIDTH, ReportDefaults.VALUE_COLUMN_WIDTH);
    }

    public MarkdownTableRenderer(int keyWidth, int valueWidth) {
        this.keyWidth = keyWidth;
        this.valueWidth = valueWidth;
    }

    public List<String> render(ResultMatrix matrix, TableSpec spec) {
        Objects.requireNonNull(matrix, "matrix");
        Objects.requireNonNull(spec, "spec");

        List<LengthRange> columns = new ArrayList<>();
        for (LengthRange r : matrix.ranges()) {
            if (spec.selector().test(r)) {
                columns.add(r);
            }
        }
        if (columns.isEmpty()) {
            return List.of();
        }

        List<String> lines = new ArrayList<>(matrix.implementations().size() + 4);
        lines.add("### " + spec.title());

        List<String> header = new ArrayList<>(columns.size() + 1);
        header.add(MarkdownCells.left(KEY_HEADER, keyWidth));
        for (LengthRange r : columns) {
            header.add(MarkdownCells.center(spec.label().apply(r), valueWidth));
        }
        lines.add(MarkdownCells.row(header));

        List<String> align = new ArrayList<>(columns.size() + 1);
        align.add(MarkdownCells.left(KEY_ALIGN, keyWidth));
        for (int i = 0; i < columns.size(); i++) {
            align.add(MarkdownCells.center(VALUE_ALIGN, valueWidth));
        }
        lines.add(MarkdownCells.row(align));

        for (String impl : matrix.implementations()) {
            List<String> row = new ArrayList<>(columns.size() + 1);
            row.add(MarkdownCells.left(impl, keyWidth));
            for (LengthRange r : columns) {
                OptionalDouble v = matrix.value(impl, r);
                row.add(v.isPresent()
                    ? MarkdownCells.right(MarkdownCells.decimal(v.getAsDouble()), valueWidth)
                    : MarkdownCells.center(ReportDefaults.MISSING_CELL, valueWidth));
            }
            lines.add(MarkdownCells.row(row));
        }
        lines.add("");
        return lines;
    }

    public List<String> renderAll(ResultMatrix matrix, List<TableSpec> specs) {
        List<String> lines = new ArrayList<>();
        for (TableSpec spec : specs) {
            lines.addAll(render(matrix, spec));
        }
        return lines;
    }
}
