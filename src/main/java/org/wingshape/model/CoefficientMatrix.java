package org.wingshape.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Samples x 4H coefficient table stored column by column.
 *
 * Row order is the sample identity shared by every analysis step.
 */
public final class CoefficientMatrix {

    private final CoefficientLayout layout;
    private final double[][] columns;
    private final int rows;

    private CoefficientMatrix(CoefficientLayout layout, double[][] columns, int rows) {
        this.layout = layout;
        this.columns = columns;
        this.rows = rows;
    }

    public static CoefficientMatrix of(List<Specimen> specimens) {
        Objects.requireNonNull(specimens, "specimens must not be null");
        if (specimens.isEmpty()) {
            throw new IllegalArgumentException("specimens must not be empty");
        }
        CoefficientLayout layout = specimens.get(0).coefficients().layout();
        int n = specimens.size();
        double[][] cols = new double[layout.size()][n];

        for (int i = 0; i < n; i++) {
            HarmonicCoefficients c = specimens.get(i).coefficients();
            if (!c.layout().equals(layout)) {
                throw new IllegalArgumentException(
                        "Inconsistent coefficient layout for id=" + specimens.get(i).id()
                                + ". Expected=" + layout + ", but got=" + c.layout()
                );
            }
            for (int j = 0; j < layout.size(); j++) {
                cols[j][i] = c.get(j);
            }
        }
        return new CoefficientMatrix(layout, cols, n);
    }

    public CoefficientLayout layout() {
        return layout;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return columns.length;
    }

    public double get(int row, int col) {
        return columns[col][row];
    }

    /** Copy of one column. */
    public double[] column(int col) {
        return Arrays.copyOf(columns[col], rows);
    }

    /** Copy of one column addressed by name (e.g. "b3"). */
    public double[] column(String name) {
        int idx = layout.indexOf(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown coefficient column: " + name);
        }
        return column(idx);
    }

    /** Copy of one sample's coefficients in layout order. */
    public double[] row(int row) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException("row=" + row + ", rows=" + rows);
        }
        double[] out = new double[columns.length];
        for (int j = 0; j < columns.length; j++) {
            out[j] = columns[j][row];
        }
        return out;
    }

    /** Row-major copy, suitable for linear algebra. */
    public double[][] toArray() {
        double[][] out = new double[rows][];
        for (int i = 0; i < rows; i++) {
            out[i] = row(i);
        }
        return out;
    }
}
