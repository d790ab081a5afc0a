package com.acme.bench.report.util;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved runtime settings for one report invocation.
 *
 * @param root            directory holding one sub-directory per benchmark group
 * @param opsPerIteration number of operations one measured iteration performs
 */
public record ReportConfig(Path root, int opsPerIteration) {

    public ReportConfig {
        Objects.requireNonNull(root, "root");
        if (opsPerIteration <= 0) {
            throw new IllegalArgumentException("opsPerIteration must be positive: " + opsPerIteration);
        }
    }

    static ReportConfig defaults() {
        return new ReportConfig(Path.of(ReportDefaults.DEFAULT_ROOT), ReportDefaults.DEFAULT_OPS_PER_ITERATION);
    }

    public static ReportConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ReportConfig fromEnvironment(Map<String, String> env) {
        String root = EnvVars.getOrDefault(env, ReportEnvKeys.BENCH_REPORT_ROOT, ReportDefaults.DEFAULT_ROOT);
        int ops = EnvVars.getIntClamped(
            env,
            ReportEnvKeys.BENCH_REPORT_OPS_PER_ITERATION,
            ReportDefaults.DEFAULT_OPS_PER_ITERATION,
            1,
            ReportDefaults.MAX_OPS_PER_ITERATION
        );
        return new ReportConfig(Path.of(root), ops);
    }
}
