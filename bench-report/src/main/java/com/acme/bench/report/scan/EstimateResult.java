package com.acme.bench.report.scan;

public sealed interface EstimateResult permits EstimateResult.Found, EstimateResult.Missing, EstimateResult.Unreadable {
    record Found(double pointEstimate) implements EstimateResult {}
    record Missing() implements EstimateResult {}
    record Unreadable(String reason) implements EstimateResult {}
}
