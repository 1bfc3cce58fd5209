package org.wingshape.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wingshape.config.AnalysisConfig;
import org.wingshape.diagnostics.DataFormatException;
import org.wingshape.io.json.AnalysisConfigLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Batch entry point.
 *
 * Usage: wing-shape-analysis &lt;config.json | coefficients.csv&gt;
 * A CSV argument runs with the default configuration and writes outputs next to it.
 */
public final class WingShapeCli {

    private static final Logger log = LoggerFactory.getLogger(WingShapeCli.class);

    static final int OK = 0;
    static final int DATA_ERROR = 1;
    static final int USAGE_ERROR = 2;

    private WingShapeCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        if (args == null || args.length != 1) {
            out.println("Usage: wing-shape-analysis <config.json | coefficients.csv>");
            return USAGE_ERROR;
        }
        Path path = Path.of(args[0]);
        if (!Files.isRegularFile(path)) {
            out.println("No such file: " + path);
            return USAGE_ERROR;
        }

        try {
            AnalysisConfig config = path.getFileName().toString().endsWith(".json")
                    ? new AnalysisConfigLoader().load(path)
                    : AnalysisConfig.defaults(path);
            AnalysisReport report = new AnalysisService(config).run();

            for (var row : report.percentages().rows()) {
                out.printf("%-24s %-14s %8.3f%%%n", row.configuration(), row.term(), row.percent());
            }
            for (Path p : report.written()) {
                out.println("Wrote " + p);
            }
            return OK;
        } catch (DataFormatException e) {
            log.error("Invalid input: {}", e.getMessage());
            out.println("Invalid input: " + e.getMessage());
            return DATA_ERROR;
        } catch (IOException | java.io.UncheckedIOException e) {
            log.error("I/O failure", e);
            out.println("I/O failure: " + e.getMessage());
            return DATA_ERROR;
        }
    }
}
