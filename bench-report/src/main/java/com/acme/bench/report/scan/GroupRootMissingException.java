package com.acme.bench.report.scan;

import java.nio.file.Path;

/**
 * Thrown when the directory of a benchmark group does not exist. Callers report the path and
 * stop without rendering anything.
 */
public final class GroupRootMissingException extends Exception {
    private final Path path;

    public GroupRootMissingException(Path path) {
        super("Directory " + path + " not found.");
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
