package com.acme.bench.report.scan;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-run tally of what happened to each located directory. Diagnostic only.
 */
public final class ScanStats {
    private final Map<SkipReason, Long> skipped = new EnumMap<>(SkipReason.class);
    private long directories;
    private long records;
    private long unreportedRanges;

    public void directorySeen() {
        directories++;
    }

    public void recordAccepted(LengthRange range) {
        records++;
        if (range.isUnreported()) {
            unreportedRanges++;
        }
    }

    public void skip(SkipReason reason) {
        skipped.merge(reason, 1L, Long::sum);
    }

    public long directories() {
        return directories;
    }

    public long records() {
        return records;
    }

    public long unreportedRanges() {
        return unreportedRanges;
    }

    public long skipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0L);
    }

    long totalSkipped() {
        long total = 0L;
        for (long v : skipped.values()) {
            total += v;
        }
        return total;
    }

    @Override
    public String toString() {
        return "directories=" + directories
            + " records=" + records
            + " skipped=" + skipped
            + " unreportedRanges=" + unreportedRanges;
    }
}
