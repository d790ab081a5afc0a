package com.acme.bench.report.series;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Prints the memory series found in a directory (default: working directory) as a markdown table.
 */
public final class MemoryReportMain {
    private MemoryReportMain() {
    }

    public static void main(String[] args) throws Exception {
        Path dir = args.length > 0 ? Path.of(args[0]) : Path.of(".");
        report(dir, System.out);
    }

    static void report(Path dir, PrintStream out) throws IOException {
        SeriesFileReader reader = new SeriesFileReader();
        List<Path> files = reader.listFiles(dir);
        if (files.isEmpty()) {
            out.println("No CSV files found in " + dir + ".");
            return;
        }
        List<CoordinateSeries> series = reader.readAll(files);
        if (series.isEmpty()) {
            out.println("No readable CSV files in " + dir + " (" + files.size() + " malformed).");
            return;
        }
        for (String line : new MemoryTableRenderer().render(series)) {
            out.println(line);
        }
        out.flush();
    }
}
