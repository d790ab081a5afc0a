package com.acme.bench.report.scan;

public enum SkipReason {
    MALFORMED_NAME,
    ESTIMATE_MISSING,
    ESTIMATE_UNREADABLE
}
