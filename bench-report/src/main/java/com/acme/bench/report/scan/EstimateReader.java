package com.acme.bench.report.scan;

import com.acme.bench.report.util.JsonCodec;
import com.acme.bench.report.util.ReportDefaults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the mean point estimate of the latest run stored in a result directory
 * ({@code <dir>/new/estimates.json}).
 */
public final class EstimateReader {

    public Path estimatesPath(Path resultDir) {
        Objects.requireNonNull(resultDir, "resultDir");
        return resultDir.resolve(ReportDefaults.CURRENT_RUN_DIR).resolve(ReportDefaults.ESTIMATES_FILE);
    }

    public EstimateResult read(Path resultDir) {
        Path file = estimatesPath(resultDir);
        if (!Files.isRegularFile(file)) {
            return new EstimateResult.Missing();
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            return new EstimateResult.Unreadable("invalid_json");
        } catch (IOException e) {
            return new EstimateResult.Unreadable("io_error: " + e.getClass().getSimpleName());
        }
        return extract(root);
    }

    static EstimateResult extract(JsonNode root) {
        if (root == null || !root.isObject()) {
            return new EstimateResult.Unreadable("root_not_object");
        }
        JsonNode mean = root.get("mean");
        if (mean == null || !mean.isObject()) {
            return new EstimateResult.Unreadable("missing_mean");
        }
        JsonNode point = mean.get("point_estimate");
        if (point == null || !point.isNumber()) {
            return new EstimateResult.Unreadable("missing_point_estimate");
        }
        double value = point.asDouble();
        if (!Double.isFinite(value) || value < 0.0d) {
            return new EstimateResult.Unreadable("point_estimate_out_of_range");
        }
        return new EstimateResult.Found(value);
    }
}
