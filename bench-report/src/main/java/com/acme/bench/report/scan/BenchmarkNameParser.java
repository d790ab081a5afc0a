package com.acme.bench.report.scan;

import com.acme.bench.report.util.ReportDefaults;

import java.util.Objects;

/**
 * Codec for result directory names of the form {@code <implementation>-len=<min>-<max>}.
 * <p>
 * Implementation names may themselves contain the delimiter, so decoding splits at its last
 * occurrence.
 */
public final class BenchmarkNameParser {
    private static final String DELIMITER = ReportDefaults.LENGTH_DELIMITER;

    private BenchmarkNameParser() {
    }

    public static boolean hasLengthSuffix(String name) {
        return name != null && name.contains(DELIMITER);
    }

    public static NameParseResult parse(String name) {
        Objects.requireNonNull(name, "name");
        int at = name.lastIndexOf(DELIMITER);
        if (at < 0) {
            return new NameParseResult.Malformed(name, "missing_length_delimiter");
        }
        if (at == 0) {
            return new NameParseResult.Malformed(name, "empty_implementation");
        }
        String implementation = name.substring(0, at);
        String rangePart = name.substring(at + DELIMITER.length());

        int sep = rangePart.indexOf('-');
        if (sep < 0 || sep != rangePart.lastIndexOf('-')) {
            return new NameParseResult.Malformed(name, "range_not_min_dash_max");
        }
        int min = parseUnsigned(rangePart.substring(0, sep));
        int max = parseUnsigned(rangePart.substring(sep + 1));
        if (min < 0 || max < 0) {
            return new NameParseResult.Malformed(name, "range_bound_not_integer");
        }
        if (min > max) {
            return new NameParseResult.Malformed(name, "range_min_exceeds_max");
        }
        return new NameParseResult.Parsed(new BenchmarkId(implementation, new LengthRange(min, max)));
    }

    public static String format(BenchmarkId id) {
        Objects.requireNonNull(id, "id");
        return id.implementation() + DELIMITER + id.range().min() + "-" + id.range().max();
    }

    /**
     * @return the parsed value, or -1 when {@code raw} is not a plain base-10 literal fitting an int
     */
    private static int parseUnsigned(String raw) {
        if (raw.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException overflow) {
            return -1;
        }
    }
}
