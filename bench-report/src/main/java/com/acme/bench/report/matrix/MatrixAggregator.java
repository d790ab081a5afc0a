package com.acme.bench.report.matrix;

import com.acme.bench.report.scan.BenchmarkId;

import java.util.Objects;

/**
 * Folds raw point estimates into a {@link ResultMatrix}, normalising each one from nanoseconds per
 * measured iteration to nanoseconds per operation.
 */
public final class MatrixAggregator {
    private final int opsPerIteration;
    private final ResultMatrix matrix = new ResultMatrix();

    public MatrixAggregator(int opsPerIteration) {
        if (opsPerIteration <= 0) {
            throw new IllegalArgumentException("opsPerIteration must be positive: " + opsPerIteration);
        }
        this.opsPerIteration = opsPerIteration;
    }

    public MeasurementRecord add(BenchmarkId id, double rawPointEstimate) {
        Objects.requireNonNull(id, "id");
        MeasurementRecord record = new MeasurementRecord(id.implementation(), id.range(), rawPointEstimate / opsPerIteration);
        matrix.put(record);
        return record;
    }

    public ResultMatrix matrix() {
        return matrix;
    }
}
