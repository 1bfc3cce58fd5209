package org.wingshape.model;

import java.util.Arrays;
import java.util.Collection;

/**
 * Immutable, non-empty vector of doubles. Backs a specimen's coefficient row
 * and the coordinate arrays that contour means are taken over.
 */
public final class Vector {

    private final double[] data;

    /**
     * @param values components; copied
     * @throws IllegalArgumentException if values is null or empty
     */
    public Vector(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        this.data = Arrays.copyOf(values, values.length);
    }

    public int dim() {
        return data.length;
    }

    public double[] toArrayCopy() {
        return Arrays.copyOf(data, data.length);
    }

    public double get(int index) {
        if (index < 0 || index >= data.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", dim=" + data.length);
        }
        return data[index];
    }

    public Vector scale(double alpha) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = alpha * data[i];
        }
        return new Vector(out);
    }

    /**
     * Component-wise mean.
     *
     * @throws IllegalArgumentException if the collection is empty or the dimensions differ
     */
    public static Vector average(Collection<Vector> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty collection");
        }
        int dim = vectors.iterator().next().dim();
        double[] sum = new double[dim];
        for (Vector v : vectors) {
            if (v.dim() != dim) {
                throw new IllegalArgumentException("Dimension mismatch: " + dim + " vs " + v.dim());
            }
            for (int i = 0; i < dim; i++) {
                sum[i] += v.data[i];
            }
        }
        for (int i = 0; i < dim; i++) {
            sum[i] /= vectors.size();
        }
        return new Vector(sum);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vector other)) return false;
        return Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Vector(dim=" + data.length + ")";
    }
}
