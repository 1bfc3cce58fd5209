package org.wingshape.variance;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Numeric encoding of the categorical factors plus intercept, together with the
 * term -> column-range table needed to drop one term at a time.
 */
public final class DesignMatrix {

    public static final String INTERCEPT = "Intercept";

    private final RealMatrix matrix;
    private final List<String> columnNames;
    private final Map<String, TermSlice> slices;
    private final Coding coding;

    public DesignMatrix(double[][] data, List<String> columnNames, List<TermSlice> slices, Coding coding) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(columnNames, "columnNames must not be null");
        Objects.requireNonNull(slices, "slices must not be null");
        this.coding = Objects.requireNonNull(coding, "coding must not be null");
        if (data.length == 0) {
            throw new IllegalArgumentException("design must have at least one row");
        }

        this.matrix = new Array2DRowRealMatrix(data, true);
        if (columnNames.size() != matrix.getColumnDimension()) {
            throw new IllegalArgumentException(
                    "Expected " + matrix.getColumnDimension() + " column names but got " + columnNames.size()
            );
        }
        this.columnNames = List.copyOf(columnNames);

        Map<String, TermSlice> bySlice = new LinkedHashMap<>();
        boolean[] owned = new boolean[matrix.getColumnDimension()];
        for (TermSlice s : slices) {
            if (s.end() > owned.length) {
                throw new IllegalArgumentException("Term " + s.term() + " exceeds the design width " + owned.length);
            }
            if (bySlice.putIfAbsent(s.term(), s) != null) {
                throw new IllegalArgumentException("Duplicate term: " + s.term());
            }
            for (int c = s.start(); c < s.end(); c++) {
                if (owned[c]) {
                    throw new IllegalArgumentException("Column " + c + " belongs to more than one term");
                }
                owned[c] = true;
            }
        }
        this.slices = java.util.Collections.unmodifiableMap(bySlice);
    }

    /** Defensive copy of the encoded matrix. */
    public RealMatrix matrix() {
        return matrix.copy();
    }

    public int rows() {
        return matrix.getRowDimension();
    }

    public int columns() {
        return matrix.getColumnDimension();
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public Coding coding() {
        return coding;
    }

    /** All term slices in column order, the intercept included. */
    public List<TermSlice> slices() {
        return List.copyOf(slices.values());
    }

    /** Term slices eligible for a marginal test (everything but the intercept). */
    public List<TermSlice> testableSlices() {
        List<TermSlice> out = new ArrayList<>();
        for (TermSlice s : slices.values()) {
            if (!INTERCEPT.equals(s.term())) out.add(s);
        }
        return List.copyOf(out);
    }

    public Optional<TermSlice> slice(String term) {
        return Optional.ofNullable(slices.get(term));
    }

    /**
     * The design with exactly the columns of {@code dropped} removed.
     */
    public RealMatrix without(TermSlice dropped) {
        Objects.requireNonNull(dropped, "dropped must not be null");
        if (!dropped.equals(slices.get(dropped.term()))) {
            throw new IllegalArgumentException("Term is not part of this design: " + dropped);
        }
        int[] keep = new int[columns() - dropped.width()];
        int k = 0;
        for (int c = 0; c < columns(); c++) {
            if (!dropped.contains(c)) keep[k++] = c;
        }
        int[] allRows = new int[rows()];
        for (int r = 0; r < allRows.length; r++) allRows[r] = r;
        return matrix.getSubMatrix(allRows, keep);
    }
}
