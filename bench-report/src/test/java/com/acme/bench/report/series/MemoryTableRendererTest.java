package com.acme.bench.report.series;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryTableRendererTest {
    private static final String SEP = " | ";

    @Test
    void shouldLayOutLengthRowsAndImplementationColumns() {
        List<CoordinateSeries> series = List.of(
            new CoordinateSeries("std", List.of(
                new CoordinateSeries.Point(0, 24),
                new CoordinateSeries.Point(1, 25))),
            new CoordinateSeries("cold", List.of(
                new CoordinateSeries.Point(1, 8)))
        );

        List<String> lines = new MemoryTableRenderer().render(series);

        assertEquals(List.of(
            "### String Memory Comparison [bytes]",
            key("Length") + SEP + "   cold   " + SEP + "   std    ",
            key(":---") + SEP + "   ---:   " + SEP + "   ---:   ",
            key("0") + SEP + "    -     " + SEP + "      24.0",
            key("1") + SEP + "       8.0" + SEP + "      25.0",
            ""
        ), lines);
    }

    @Test
    void shouldRenderNothingWithoutSeries() {
        assertTrue(new MemoryTableRenderer().render(List.of()).isEmpty());
    }

    @Test
    void shouldKeepFractionalLengthLabels() {
        assertEquals("3", MemoryTableRenderer.lengthLabel(3.0));
        assertEquals("2.5", MemoryTableRenderer.lengthLabel(2.5));
    }

    private static String key(String text) {
        return text + " ".repeat(18 - text.length());
    }
}
