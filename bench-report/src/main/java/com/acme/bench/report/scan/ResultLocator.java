package com.acme.bench.report.scan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Lists the result directories of a benchmark group under {@code <root>/<group>}.
 */
public final class ResultLocator {
    private final Path root;

    public ResultLocator(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path groupRoot(String group) {
        Objects.requireNonNull(group, "group");
        return root.resolve(group);
    }

    /**
     * Returns the group's child directories whose names carry a length suffix, sorted by name.
     * Plain files and unrelated directories are left out.
     */
    public List<Path> locate(String group) throws GroupRootMissingException, IOException {
        Path groupRoot = groupRoot(group);
        if (!Files.isDirectory(groupRoot)) {
            throw new GroupRootMissingException(groupRoot);
        }
        try (var stream = Files.list(groupRoot)) {
            return stream
                .filter(Files::isDirectory)
                .filter(p -> BenchmarkNameParser.hasLengthSuffix(p.getFileName().toString()))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .toList();
        }
    }
}
