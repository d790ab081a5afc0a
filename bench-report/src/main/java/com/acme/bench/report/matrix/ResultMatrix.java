package com.acme.bench.report.matrix;

import com.acme.bench.report.scan.LengthRange;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Implementation x length-range table of nanoseconds per operation.
 * <p>
 * Holds at most one value per (implementation, range); a later {@link #put} for the same pair
 * replaces the earlier value.
 */
public final class ResultMatrix {
    private final SortedMap<String, SortedMap<LengthRange, Double>> cells = new TreeMap<>();
    private final TreeSet<LengthRange> ranges = new TreeSet<>();

    /**
     * @return the value previously stored for the pair, if any
     */
    public OptionalDouble put(MeasurementRecord record) {
        Objects.requireNonNull(record, "record");
        Double previous = cells
            .computeIfAbsent(record.implementation(), k -> new TreeMap<>())
            .put(record.range(), record.nanosPerOp());
        ranges.add(record.range());
        return previous == null ? OptionalDouble.empty() : OptionalDouble.of(previous);
    }

    public OptionalDouble value(String implementation, LengthRange range) {
        Map<LengthRange, Double> row = cells.get(implementation);
        if (row == null) {
            return OptionalDouble.empty();
        }
        Double v = row.get(range);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    /** Implementation ids in lexicographic order. */
    public List<String> implementations() {
        return List.copyOf(cells.keySet());
    }

    /** Every distinct range observed, ascending by (max, min). */
    public List<LengthRange> ranges() {
        return List.copyOf(ranges);
    }

    int size() {
        int n = 0;
        for (Map<LengthRange, Double> row : cells.values()) {
            n += row.size();
        }
        return n;
    }

    boolean isEmpty() {
        return cells.isEmpty();
    }
}
