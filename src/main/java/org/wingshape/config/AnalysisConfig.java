package org.wingshape.config;

import org.wingshape.io.csv.CsvFormat;
import org.wingshape.model.CoefficientLayout;
import org.wingshape.variance.Coding;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything one analysis run needs to know, passed explicitly to each component.
 *
 * @param input coefficient table (CSV)
 * @param normalizedOutput where the size-normalized table is written
 * @param percentOutput where the percentage table is written (CSV; a sibling .json is also written)
 * @param pcScoresOutput optional PC1..PC3 score table, null to skip
 * @param harmonics harmonic order H
 * @param symbols the four coefficient family symbols (default "abcd")
 * @param speciesColumn header of the species column
 * @param sexColumn header of the sex column
 * @param idColumn optional header of the identifier column, null to use row numbers
 * @param contourPoints sampling density for synthesized contours
 * @param pcCounts principal-component truncations to compare
 * @param coding categorical coding of the design matrix
 * @param parallel whether per-specimen and per-configuration work may run in parallel
 */
public record AnalysisConfig(
        Path input,
        Path normalizedOutput,
        Path percentOutput,
        Path pcScoresOutput,
        int harmonics,
        String symbols,
        String speciesColumn,
        String sexColumn,
        String idColumn,
        int contourPoints,
        List<Integer> pcCounts,
        Coding coding,
        boolean parallel
) {

    public static final int DEFAULT_HARMONICS = 10;
    public static final int DEFAULT_CONTOUR_POINTS = 300;
    public static final List<Integer> DEFAULT_PC_COUNTS = List.of(10, 20, 30, 40);

    public AnalysisConfig {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(normalizedOutput, "normalizedOutput must not be null");
        Objects.requireNonNull(percentOutput, "percentOutput must not be null");
        Objects.requireNonNull(symbols, "symbols must not be null");
        Objects.requireNonNull(coding, "coding must not be null");
        Objects.requireNonNull(pcCounts, "pcCounts must not be null");
        if (harmonics <= 0) {
            throw new IllegalArgumentException("harmonics must be >= 1");
        }
        if (contourPoints < 2) {
            throw new IllegalArgumentException("contourPoints must be >= 2");
        }
        for (Integer k : pcCounts) {
            if (k == null || k <= 0) {
                throw new IllegalArgumentException("pcCounts entries must be >= 1: " + pcCounts);
            }
        }
        pcCounts = List.copyOf(pcCounts);
    }

    /**
     * Defaults for the field dataset: H=10, "abcd", species/gender/image_id columns,
     * outputs next to the input file.
     */
    public static AnalysisConfig defaults(Path input) {
        Objects.requireNonNull(input, "input must not be null");
        Path dir = input.toAbsolutePath().getParent();
        return new AnalysisConfig(
                input,
                dir.resolve("normalized_efd_coefficients.csv"),
                dir.resolve("sscp_percentages.csv"),
                null,
                DEFAULT_HARMONICS,
                CoefficientLayout.DEFAULT_SYMBOLS,
                CsvFormat.DEFAULT_SPECIES_COLUMN,
                CsvFormat.DEFAULT_SEX_COLUMN,
                CsvFormat.DEFAULT_ID_COLUMN,
                DEFAULT_CONTOUR_POINTS,
                DEFAULT_PC_COUNTS,
                Coding.TREATMENT,
                false
        );
    }

    public CoefficientLayout layout() {
        return new CoefficientLayout(harmonics, symbols);
    }

    public CsvFormat csvFormat() {
        return new CsvFormat(speciesColumn, sexColumn, idColumn);
    }
}
