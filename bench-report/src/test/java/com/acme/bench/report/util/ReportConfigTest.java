package com.acme.bench.report.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReportConfigTest {

    @Test
    void shouldUseDefaultsWithEmptyEnvironment() {
        ReportConfig config = ReportConfig.fromEnvironment(Map.of());
        assertEquals(Path.of("target", "criterion"), config.root());
        assertEquals(1000, config.opsPerIteration());
        assertEquals(ReportConfig.defaults(), config);
    }

    @Test
    void shouldReadOverridesFromEnvironment() {
        ReportConfig config = ReportConfig.fromEnvironment(Map.of(
            ReportEnvKeys.BENCH_REPORT_ROOT, "/tmp/criterion",
            ReportEnvKeys.BENCH_REPORT_OPS_PER_ITERATION, "0"
        ));
        assertEquals(Path.of("/tmp/criterion"), config.root());
        assertEquals(1, config.opsPerIteration());
    }

    @Test
    void shouldRejectNonPositiveBatch() {
        assertThrows(IllegalArgumentException.class, () -> new ReportConfig(Path.of("x"), 0));
    }
}
