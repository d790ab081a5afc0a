package com.acme.bench.report.cli;

import com.acme.bench.report.util.ReportConfig;
import com.acme.bench.report.util.ReportDefaults;

/**
 * Usage: {@code BenchReportMain [group]}, e.g. {@code construction} or {@code as_str}.
 */
public final class BenchReportMain {
    private BenchReportMain() {
    }

    public static void main(String[] args) throws Exception {
        String group = args.length > 0 ? args[0] : ReportDefaults.DEFAULT_GROUP;
        new ReportDriver(ReportConfig.fromEnvironment(), System.out).run(group);
    }
}
