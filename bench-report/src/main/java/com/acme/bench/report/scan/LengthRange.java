package com.acme.bench.report.scan;

import java.util.Comparator;

/**
 * Input-length bounds covered by one measurement run, inclusive on both ends.
 * <p>
 * Natural order is ascending by {@code max}, then by {@code min}, so growing sweeps and growing
 * fixed points both read left-to-right in increasing size.
 */
public record LengthRange(int min, int max) implements Comparable<LengthRange> {
    private static final Comparator<LengthRange> ORDER =
        Comparator.comparingInt(LengthRange::max).thenComparingInt(LengthRange::min);

    public LengthRange {
        if (min < 0 || max < 0) {
            throw new IllegalArgumentException("length bounds must be non-negative: " + min + ".." + max);
        }
        if (min > max) {
            throw new IllegalArgumentException("min exceeds max: " + min + ".." + max);
        }
    }

    /** Sweep from empty input up to {@code max}. */
    public boolean startsAtZero() {
        return min == 0;
    }

    /** Single-point measurement at a non-zero length. */
    public boolean isFixed() {
        return min == max && min != 0;
    }

    /**
     * Neither a sweep from zero nor a fixed point. Such ranges parse fine but no standard table
     * selects them.
     */
    public boolean isUnreported() {
        return !startsAtZero() && !isFixed();
    }

    @Override
    public int compareTo(LengthRange other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return min + "..=" + max;
    }
}
