package org.wingshape.app;

import org.wingshape.diagnostics.Diagnostic;
import org.wingshape.variance.PercentageTable;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * What one batch run produced.
 *
 * @param specimens number of specimens processed
 * @param percentages the percentage table that was written
 * @param diagnostics every numeric condition resolved during the run
 * @param written files written, in order
 */
public record AnalysisReport(int specimens, PercentageTable percentages, List<Diagnostic> diagnostics, List<Path> written) {

    public AnalysisReport {
        Objects.requireNonNull(percentages, "percentages must not be null");
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics must not be null"));
        written = List.copyOf(Objects.requireNonNull(written, "written must not be null"));
    }
}
