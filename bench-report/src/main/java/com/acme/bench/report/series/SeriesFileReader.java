package com.acme.bench.report.series;

import com.acme.bench.report.util.ReportDefaults;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads {@code <implementation>.csv} files of {@code length,bytes} pairs, one pair per line.
 */
public final class SeriesFileReader {
    private static final Logger LOG = Logger.getLogger(SeriesFileReader.class.getName());

    public CoordinateSeries read(Path file) throws IOException, SeriesFormatException {
        Objects.requireNonNull(file, "file");
        List<CoordinateSeries.Point> points = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String raw;
            int lineNo = 0;
            while ((raw = reader.readLine()) != null) {
                lineNo++;
                String line = raw.trim();
                if (line.isEmpty()) {
                    continue;
                }
                points.add(parsePoint(file, lineNo, line));
            }
        }
        return new CoordinateSeries(implementationName(file), points);
    }

    /** Series files directly inside {@code dir}, sorted by file name. */
    public List<Path> listFiles(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        try (var stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(ReportDefaults.SERIES_EXTENSION))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .toList();
        }
    }

    /**
     * Reads every series file in {@code dir}. Files that fail to parse are logged and left out.
     */
    public List<CoordinateSeries> readAll(Path dir) throws IOException {
        return readAll(listFiles(dir));
    }

    public List<CoordinateSeries> readAll(List<Path> files) throws IOException {
        Objects.requireNonNull(files, "files");
        List<CoordinateSeries> out = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                out.add(read(file));
            } catch (SeriesFormatException e) {
                LOG.warning("Skipping series file: " + e.getMessage());
            }
        }
        return out;
    }

    static String implementationName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static CoordinateSeries.Point parsePoint(Path file, int lineNo, String line) throws SeriesFormatException {
        int comma = line.indexOf(',');
        if (comma < 0 || comma != line.lastIndexOf(',')) {
            throw new SeriesFormatException(file, lineNo, "expected exactly two comma-separated values");
        }
        try {
            double length = Double.parseDouble(line.substring(0, comma).trim());
            double bytes = Double.parseDouble(line.substring(comma + 1).trim());
            return new CoordinateSeries.Point(length, bytes);
        } catch (NumberFormatException e) {
            throw new SeriesFormatException(file, lineNo, "not a number: " + line);
        }
    }
}
