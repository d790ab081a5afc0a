package com.acme.bench.report.matrix;

import com.acme.bench.report.scan.LengthRange;

import java.util.Objects;

/**
 * One aggregated cell: the cost of a single operation, in nanoseconds.
 */
public record MeasurementRecord(String implementation, LengthRange range, double nanosPerOp) {

    public MeasurementRecord {
        Objects.requireNonNull(implementation, "implementation");
        Objects.requireNonNull(range, "range");
    }
}
