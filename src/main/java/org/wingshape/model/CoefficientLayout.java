package org.wingshape.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Naming and ordering scheme of the 4H harmonic coefficients.
 *
 * Column order is symbol-major: a1..aH, b1..bH, c1..cH, d1..dH.
 * The four symbols play the roles of a, b, c and d in that order.
 *
 * @param harmonics harmonic order H (must be >= 1)
 * @param symbols four distinct characters naming the coefficient families (e.g. "abcd")
 */
public record CoefficientLayout(int harmonics, String symbols) {

    public static final String DEFAULT_SYMBOLS = "abcd";

    public static final int A = 0;
    public static final int B = 1;
    public static final int C = 2;
    public static final int D = 3;

    public CoefficientLayout {
        if (harmonics <= 0) {
            throw new IllegalArgumentException("harmonics must be >= 1");
        }
        if (symbols == null || symbols.length() != 4) {
            throw new IllegalArgumentException("symbols must contain exactly four characters");
        }
        if (symbols.chars().distinct().count() != 4) {
            throw new IllegalArgumentException("symbols must be distinct: " + symbols);
        }
    }

    public static CoefficientLayout ofHarmonics(int harmonics) {
        return new CoefficientLayout(harmonics, DEFAULT_SYMBOLS);
    }

    /** Number of coefficients per specimen (4H). */
    public int size() {
        return 4 * harmonics;
    }

    /**
     * Flat index of one coefficient.
     *
     * @param family one of {@link #A}, {@link #B}, {@link #C}, {@link #D}
     * @param n harmonic number, 1-based
     */
    public int indexOf(int family, int n) {
        if (family < A || family > D) {
            throw new IllegalArgumentException("family must be in [0, 3]: " + family);
        }
        if (n < 1 || n > harmonics) {
            throw new IndexOutOfBoundsException("harmonic=" + n + ", order=" + harmonics);
        }
        return family * harmonics + (n - 1);
    }

    /**
     * @return the flat index of a column name such as "a1" or "d10", or -1 if it is not part of the layout
     */
    public int indexOf(String columnName) {
        if (columnName == null || columnName.length() < 2) {
            return -1;
        }
        int family = symbols.indexOf(columnName.charAt(0));
        if (family < 0) {
            return -1;
        }
        String digits = columnName.substring(1);
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return -1;
            }
        }
        if (digits.startsWith("0")) {
            return -1;
        }
        int n;
        try {
            n = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
        if (n < 1 || n > harmonics) {
            return -1;
        }
        return indexOf(family, n);
    }

    public String columnName(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + size());
        }
        return String.valueOf(symbols.charAt(index / harmonics)) + (index % harmonics + 1);
    }

    public List<String> columnNames() {
        List<String> out = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            out.add(columnName(i));
        }
        return List.copyOf(out);
    }
}
