package com.acme.bench.report.scan;

import com.acme.bench.report.ResultTreeFixture;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ResultLocatorTest {

    @Test
    void shouldListOnlyLengthSuffixedDirectoriesSortedByName() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            tree.result("construction", "std-len=0-8", 1.0);
            tree.result("construction", "cold-string-len=4-4", 1.0);
            tree.emptyResult("construction", "report");
            Files.writeString(tree.group("construction").resolve("notes-len=0-8"), "not a directory");

            List<Path> dirs = new ResultLocator(tree.root()).locate("construction");

            assertEquals(List.of("cold-string-len=4-4", "std-len=0-8"),
                dirs.stream().map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void shouldSignalMissingGroupRoot() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            ResultLocator locator = new ResultLocator(tree.root());
            GroupRootMissingException e = assertThrows(GroupRootMissingException.class, () -> locator.locate("nope"));
            assertEquals(tree.root().resolve("nope"), e.path());
        }
    }

    @Test
    void shouldTreatPlainFileAsMissingGroupRoot() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            Files.writeString(tree.root().resolve("as_str"), "x");
            assertThrows(GroupRootMissingException.class, () -> new ResultLocator(tree.root()).locate("as_str"));
        }
    }

    @Test
    void shouldReturnEmptyListForEmptyGroup() throws Exception {
        try (ResultTreeFixture tree = new ResultTreeFixture()) {
            tree.group("len");
            assertEquals(List.of(), new ResultLocator(tree.root()).locate("len"));
        }
    }
}
