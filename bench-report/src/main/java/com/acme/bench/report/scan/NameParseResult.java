package com.acme.bench.report.scan;

public sealed interface NameParseResult permits NameParseResult.Parsed, NameParseResult.Malformed {
    record Parsed(BenchmarkId id) implements NameParseResult {}
    record Malformed(String name, String reason) implements NameParseResult {}
}
