package com.acme.bench.report.util;

/**
 * Canonical environment variable names read by the report tools.
 */
public final class ReportEnvKeys {
    public static final String BENCH_REPORT_ROOT = "BENCH_REPORT_ROOT";
    public static final String BENCH_REPORT_OPS_PER_ITERATION = "BENCH_REPORT_OPS_PER_ITERATION";

    private ReportEnvKeys() {
    }
}
