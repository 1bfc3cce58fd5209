package org.wingshape.model;

import java.util.Objects;

/**
 * Immutable EFD coefficient set {a_n, b_n, c_n, d_n | n = 1..H} of one specimen.
 */
public final class HarmonicCoefficients {

    private final CoefficientLayout layout;
    private final Vector values;

    public HarmonicCoefficients(CoefficientLayout layout, Vector values) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.values = Objects.requireNonNull(values, "values must not be null");
        if (values.dim() != layout.size()) {
            throw new IllegalArgumentException(
                    "Expected " + layout.size() + " coefficients for H=" + layout.harmonics()
                            + " but got " + values.dim()
            );
        }
    }

    public HarmonicCoefficients(CoefficientLayout layout, double[] values) {
        this(layout, new Vector(values));
    }

    public CoefficientLayout layout() {
        return layout;
    }

    public int harmonics() {
        return layout.harmonics();
    }

    public double a(int n) {
        return values.get(layout.indexOf(CoefficientLayout.A, n));
    }

    public double b(int n) {
        return values.get(layout.indexOf(CoefficientLayout.B, n));
    }

    public double c(int n) {
        return values.get(layout.indexOf(CoefficientLayout.C, n));
    }

    public double d(int n) {
        return values.get(layout.indexOf(CoefficientLayout.D, n));
    }

    /** Value at a flat layout index. */
    public double get(int index) {
        return values.get(index);
    }

    public Vector asVector() {
        return values;
    }

    public double[] toArrayCopy() {
        return values.toArrayCopy();
    }

    public HarmonicCoefficients scaled(double k) {
        return new HarmonicCoefficients(layout, values.scale(k));
    }

    /**
     * Divides every coefficient by {@code p}.
     *
     * @throws IllegalArgumentException if p is zero or not finite
     */
    public HarmonicCoefficients divided(double p) {
        if (p == 0.0 || !Double.isFinite(p)) {
            throw new IllegalArgumentException("divisor must be finite and non-zero: " + p);
        }
        double[] out = values.toArrayCopy();
        for (int i = 0; i < out.length; i++) {
            out[i] /= p;
        }
        return new HarmonicCoefficients(layout, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HarmonicCoefficients other)) return false;
        return layout.equals(other.layout) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(layout, values);
    }

    @Override
    public String toString() {
        return "HarmonicCoefficients(H=" + layout.harmonics() + ")";
    }
}
