package com.acme.bench.report.scan;

import java.util.Objects;

/**
 * Decoded identity of one result directory: which implementation ran, over which lengths.
 */
public record BenchmarkId(String implementation, LengthRange range) {

    public BenchmarkId {
        Objects.requireNonNull(implementation, "implementation");
        Objects.requireNonNull(range, "range");
        if (implementation.isEmpty()) {
            throw new IllegalArgumentException("implementation must not be empty");
        }
    }
}
