package com.acme.bench.report.scan;

import com.acme.bench.report.ResultTreeFixture;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class EstimateReaderTest {
    private final EstimateReader reader = new EstimateReader();

    @Test
    void shouldReadMeanPointEstimate() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            Path dir = tree.result("construction", "std-len=0-8", 8123.5);
            EstimateResult result = reader.read(dir);
            assertEquals(new EstimateResult.Found(8123.5), result);
        }
    }

    @Test
    void shouldReportMissingWhenCurrentRunAbsent() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            Path dir = tree.emptyResult("construction", "std-len=0-8");
            assertInstanceOf(EstimateResult.Missing.class, reader.read(dir));
        }
    }

    @Test
    void shouldReportUnreadableForBadContent() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            assertUnreadable(tree.resultWithEstimates("g", "a-len=0-1", "{not json"), "invalid_json");
            assertUnreadable(tree.resultWithEstimates("g", "b-len=0-1", "[1,2]"), "root_not_object");
            assertUnreadable(tree.resultWithEstimates("g", "c-len=0-1", "{\"median\":{\"point_estimate\":1}}"), "missing_mean");
            assertUnreadable(tree.resultWithEstimates("g", "d-len=0-1", "{\"mean\":{}}"), "missing_point_estimate");
            assertUnreadable(tree.resultWithEstimates("g", "e-len=0-1", "{\"mean\":{\"point_estimate\":\"12\"}}"), "missing_point_estimate");
            assertUnreadable(tree.resultWithEstimates("g", "f-len=0-1", "{\"mean\":{\"point_estimate\":-1.0}}"), "point_estimate_out_of_range");
            assertUnreadable(tree.resultWithEstimates("g", "g-len=0-1", "{\"mean\":{\"point_estimate\":8000.0}} garbage"), "invalid_json");
            assertUnreadable(tree.resultWithEstimates("g", "h-len=0-1", "{\"mean\":{\"point_estimate\":8000.0}}{}"), "invalid_json");
        }
    }

    @Test
    void shouldAcceptTrailingWhitespace() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            Path dir = tree.resultWithEstimates("g", "a-len=0-1", "{\"mean\":{\"point_estimate\":8000.0}}\n  \n");
            assertEquals(new EstimateResult.Found(8000.0), reader.read(dir));
        }
    }

    @Test
    void shouldResolveEstimatesUnderNewRun() {
        assertEquals(Path.of("x", "new", "estimates.json"), reader.estimatesPath(Path.of("x")));
    }

    private void assertUnreadable(Path dir, String reason) {
        EstimateResult result = reader.read(dir);
        assertInstanceOf(EstimateResult.Unreadable.class, result, dir.toString());
        assertEquals(reason, ((EstimateResult.Unreadable) result).reason());
    }
}
