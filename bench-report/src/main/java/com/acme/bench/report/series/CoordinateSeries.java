package com.acme.bench.report.series;

import java.util.List;
import java.util.Objects;

/**
 * Memory footprint of one implementation as (string length, bytes) points, in file order.
 */
public record CoordinateSeries(String implementation, List<Point> points) {

    public CoordinateSeries {
        Objects.requireNonNull(implementation, "implementation");
        points = List.copyOf(Objects.requireNonNull(points, "points"));
    }

    public record Point(double length, double bytes) {}
}
