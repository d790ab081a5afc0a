package com.acme.bench.report.util;

/**
 * Default locations, naming tokens, and layout constants for the report tools.
 * <p>
 * Values here apply when the corresponding environment variable is not set.
 */
public final class ReportDefaults {

    // ---- Input tree ----
    public static final String DEFAULT_ROOT = "target/criterion";
    public static final String DEFAULT_GROUP = "construction";
    public static final String LENGTH_DELIMITER = "-len=";
    public static final String CURRENT_RUN_DIR = "new";
    public static final String ESTIMATES_FILE = "estimates.json";

    // ---- Measurement ----
    public static final int DEFAULT_OPS_PER_ITERATION = 1000;
    public static final int MAX_OPS_PER_ITERATION = 1_000_000_000;

    // ---- Markdown layout ----
    public static final int KEY_COLUMN_WIDTH = 18;
    public static final int VALUE_COLUMN_WIDTH = 10;
    public static final String MISSING_CELL = "-";

    // ---- Memory series ----
    public static final String SERIES_EXTENSION = ".csv";

    private ReportDefaults() {
    }
}
