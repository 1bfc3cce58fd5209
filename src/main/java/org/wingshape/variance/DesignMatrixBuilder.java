package org.wingshape.variance;

import org.wingshape.diagnostics.DataFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Builds the full-factorial design (intercept, species, sex, species:sex) from two label lists.
 *
 * Levels are sorted; the first one is the treatment-coding reference.
 */
public final class DesignMatrixBuilder {

    public static final String SPECIES = "species";
    public static final String SEX = "sex";
    public static final String SPECIES_BY_SEX = "species:sex";

    private final Coding coding;

    public DesignMatrixBuilder(Coding coding) {
        this.coding = Objects.requireNonNull(coding, "coding must not be null");
    }

    public DesignMatrix build(List<String> speciesLabels, List<String> sexLabels) {
        Objects.requireNonNull(speciesLabels, "speciesLabels must not be null");
        Objects.requireNonNull(sexLabels, "sexLabels must not be null");
        if (speciesLabels.size() != sexLabels.size()) {
            throw new IllegalArgumentException(
                    "Label lists differ in length: " + speciesLabels.size() + " vs " + sexLabels.size()
            );
        }
        if (speciesLabels.isEmpty()) {
            throw new IllegalArgumentException("Label lists must not be empty");
        }

        List<String> speciesLevels = levels(SPECIES, speciesLabels);
        List<String> sexLevels = levels(SEX, sexLabels);

        int n = speciesLabels.size();
        double[][] speciesCols = encode(speciesLabels, speciesLevels);
        double[][] sexCols = encode(sexLabels, sexLevels);

        int ps = speciesCols[0].length;
        int pg = sexCols[0].length;
        int width = 1 + ps + pg + ps * pg;

        double[][] data = new double[n][width];
        for (int i = 0; i < n; i++) {
            int c = 0;
            data[i][c++] = 1.0;
            for (int s = 0; s < ps; s++) data[i][c++] = speciesCols[i][s];
            for (int g = 0; g < pg; g++) data[i][c++] = sexCols[i][g];
            for (int s = 0; s < ps; s++) {
                for (int g = 0; g < pg; g++) {
                    data[i][c++] = speciesCols[i][s] * sexCols[i][g];
                }
            }
        }

        List<String> names = new ArrayList<>(width);
        names.add(DesignMatrix.INTERCEPT);
        List<String> speciesNames = columnNames(SPECIES, speciesLevels);
        List<String> sexNames = columnNames(SEX, sexLevels);
        names.addAll(speciesNames);
        names.addAll(sexNames);
        for (String s : speciesNames) {
            for (String g : sexNames) {
                names.add(s + ":" + g);
            }
        }

        List<TermSlice> slices = List.of(
                new TermSlice(DesignMatrix.INTERCEPT, 0, 1),
                new TermSlice(SPECIES, 1, 1 + ps),
                new TermSlice(SEX, 1 + ps, 1 + ps + pg),
                new TermSlice(SPECIES_BY_SEX, 1 + ps + pg, width)
        );
        return new DesignMatrix(data, names, slices, coding);
    }

    private static List<String> levels(String factor, List<String> labels) {
        TreeSet<String> distinct = new TreeSet<>();
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            if (label == null || label.isBlank()) {
                throw new DataFormatException("design", "blank " + factor + " label at row " + (i + 1));
            }
            distinct.add(label);
        }
        if (distinct.size() < 2) {
            throw new DataFormatException("design", "factor '" + factor + "' needs at least two levels but has " + distinct);
        }
        return List.copyOf(distinct);
    }

    private double[][] encode(List<String> labels, List<String> levels) {
        int width = levels.size() - 1;
        double[][] out = new double[labels.size()][width];
        String last = levels.get(levels.size() - 1);
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            switch (coding) {
                case TREATMENT -> {
                    int idx = levels.indexOf(label);
                    if (idx > 0) out[i][idx - 1] = 1.0;
                }
                case SUM -> {
                    if (label.equals(last)) {
                        for (int j = 0; j < width; j++) out[i][j] = -1.0;
                    } else {
                        out[i][levels.indexOf(label)] = 1.0;
                    }
                }
                default -> throw new IllegalStateException("Unsupported coding: " + coding);
            }
        }
        return out;
    }

    private List<String> columnNames(String factor, List<String> levels) {
        List<String> out = new ArrayList<>();
        if (coding == Coding.TREATMENT) {
            for (int j = 1; j < levels.size(); j++) out.add(factor + "[T." + levels.get(j) + "]");
        } else {
            for (int j = 0; j < levels.size() - 1; j++) out.add(factor + "[S." + levels.get(j) + "]");
        }
        return out;
    }
}
