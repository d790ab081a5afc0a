package com.acme.bench.report.cli;

import com.acme.bench.report.matrix.MatrixAggregator;
import com.acme.bench.report.matrix.ResultMatrix;
import com.acme.bench.report.render.MarkdownTableRenderer;
import com.acme.bench.report.render.TableSpec;
import com.acme.bench.report.scan.BenchmarkId;
import com.acme.bench.report.scan.BenchmarkNameParser;
import com.acme.bench.report.scan.EstimateReader;
import com.acme.bench.report.scan.EstimateResult;
import com.acme.bench.report.scan.GroupRootMissingException;
import com.acme.bench.report.scan.NameParseResult;
import com.acme.bench.report.scan.ResultLocator;
import com.acme.bench.report.scan.ScanStats;
import com.acme.bench.report.scan.SkipReason;
import com.acme.bench.report.util.ReportConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one report: locate result directories, decode and read each one, aggregate, print the
 * variable-length table and then the fixed-length table.
 * <p>
 * Per-directory problems are skipped; only a missing group directory stops the run, and even
 * that is reported on the output stream rather than raised, so the process still exits normally.
 */
public final class ReportDriver {
    private static final Logger LOG = Logger.getLogger(ReportDriver.class.getName());

    private final ReportConfig config;
    private final ResultLocator locator;
    private final EstimateReader estimateReader;
    private final MarkdownTableRenderer renderer;
    private final PrintStream out;

    public ReportDriver(ReportConfig config, PrintStream out) {
        this(config, new ResultLocator(config.root()), new EstimateReader(), new MarkdownTableRenderer(), out);
    }

    ReportDriver(ReportConfig config,
                 ResultLocator locator,
                 EstimateReader estimateReader,
                 MarkdownTableRenderer renderer,
                 PrintStream out) {
        this.config = Objects.requireNonNull(config, "config");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.estimateReader = Objects.requireNonNull(estimateReader, "estimateReader");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.out = Objects.requireNonNull(out, "out");
    }

    public void run(String group) throws IOException {
        ScanStats stats = new ScanStats();
        ResultMatrix matrix;
        try {
            matrix = collect(group, stats);
        } catch (GroupRootMissingException e) {
            out.println("Error: " + e.getMessage());
            return;
        }
        LOG.info("group=" + group + " " + stats);

        for (String line : renderer.renderAll(matrix, TableSpec.standard(group))) {
            out.println(line);
        }
        out.flush();
    }

    public ResultMatrix collect(String group, ScanStats stats) throws GroupRootMissingException, IOException {
        Objects.requireNonNull(stats, "stats");
        List<Path> dirs = locator.locate(group);
        MatrixAggregator aggregator = new MatrixAggregator(config.opsPerIteration());
        for (Path dir : dirs) {
            stats.directorySeen();
            String name = dir.getFileName().toString();

            NameParseResult parsed = BenchmarkNameParser.parse(name);
            if (parsed instanceof NameParseResult.Malformed malformed) {
                skip(stats, SkipReason.MALFORMED_NAME, name, malformed.reason());
                continue;
            }
            BenchmarkId id = ((NameParseResult.Parsed) parsed).id();

            EstimateResult estimate = estimateReader.read(dir);
            if (estimate instanceof EstimateResult.Missing) {
                skip(stats, SkipReason.ESTIMATE_MISSING, name, "no " + estimateReader.estimatesPath(dir));
                continue;
            }
            if (estimate instanceof EstimateResult.Unreadable unreadable) {
                skip(stats, SkipReason.ESTIMATE_UNREADABLE, name, unreadable.reason());
                continue;
            }

            aggregator.add(id, ((EstimateResult.Found) estimate).pointEstimate());
            stats.recordAccepted(id.range());
            if (id.range().isUnreported()) {
                LOG.fine(() -> "Range " + id.range() + " of " + name + " is neither a sweep from zero nor a fixed point; it appears in no table");
            }
        }
        return aggregator.matrix();
    }

    private static void skip(ScanStats stats, SkipReason reason, String name, String detail) {
        stats.skip(reason);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Skipping " + name + ": " + reason + " (" + detail + ")");
        }
    }
}
