package com.acme.bench.report.series;

import java.nio.file.Path;

public class SeriesFormatException extends Exception {
    private final Path file;
    private final int line;

    public SeriesFormatException(Path file, int line, String message) {
        super(file + ":" + line + ": " + message);
        this.file = file;
        this.line = line;
    }

    public Path file() { return file; }
    public int line() { return line; }
}
