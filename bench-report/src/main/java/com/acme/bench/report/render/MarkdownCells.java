package com.acme.bench.report.render;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Fixed-width cell padding for markdown tables that stay readable as raw text. Content wider than
 * the column is kept whole.
 */
public final class MarkdownCells {
    public static final String CELL_SEPARATOR = " | ";

    private MarkdownCells() {
    }

    public static String left(String text, int width) {
        int pad = width - text.length();
        return pad <= 0 ? text : text + " ".repeat(pad);
    }

    public static String right(String text, int width) {
        int pad = width - text.length();
        return pad <= 0 ? text : " ".repeat(pad) + text;
    }

    /** Centers {@code text}; an odd leftover space goes to the right. */
    public static String center(String text, int width) {
        int pad = width - text.length();
        if (pad <= 0) {
            return text;
        }
        int leftPad = pad / 2;
        return " ".repeat(leftPad) + text + " ".repeat(pad - leftPad);
    }

    /**
     * One decimal place, rounding the exact binary value half-even, so {@code 8.25} prints as
     * {@code 8.2} and {@code 0.15} (stored just below) as {@code 0.1}.
     */
    public static String decimal(double value) {
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }

    public static String row(List<String> cells) {
        return String.join(CELL_SEPARATOR, cells);
    }
}
