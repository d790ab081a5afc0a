package com.acme.bench.report.render;

import com.acme.bench.report.scan.LengthRange;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Which ranges a rendered table shows and how their column headers read.
 */
public record TableSpec(String title, Predicate<LengthRange> selector, Function<LengthRange, String> label) {

    public TableSpec {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(label, "label");
    }

    /** Sweeps from empty input: {@code 0..=N}. */
    public static TableSpec variableLength(String group) {
        return new TableSpec(
            displayName(group) + ": Variable Length (0..=N) [ns/op]",
            LengthRange::startsAtZero,
            r -> "0..=" + r.max()
        );
    }

    /** Single-point lengths: {@code N..=N}. */
    public static TableSpec fixedLength(String group) {
        return new TableSpec(
            displayName(group) + ": Fixed Length (N..=N) [ns/op]",
            LengthRange::isFixed,
            r -> r.max() + "..=" + r.max()
        );
    }

    /** Variable-length table first, then fixed-length. */
    public static List<TableSpec> standard(String group) {
        return List.of(variableLength(group), fixedLength(group));
    }

    static String displayName(String group) {
        Objects.requireNonNull(group, "group");
        if (group.isEmpty()) {
            return group;
        }
        return group.substring(0, 1).toUpperCase(Locale.ROOT) + group.substring(1).toLowerCase(Locale.ROOT);
    }
}
