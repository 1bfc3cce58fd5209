package org.wingshape.variance;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Objects;

/**
 * Least-squares projections built on the Moore-Penrose pseudo-inverse, so aliased or
 * collinear designs never fail.
 */
public final class Projections {

    private Projections() {
    }

    /**
     * (A)+ via SVD. Singular values below the decomposition's tolerance are treated as zero.
     */
    public static RealMatrix pseudoInverse(RealMatrix a) {
        Objects.requireNonNull(a, "a must not be null");
        return new SingularValueDecomposition(a).getSolver().getInverse();
    }

    /**
     * Hat matrix P = X (X'X)+ X'.
     */
    public static RealMatrix hat(RealMatrix x) {
        Objects.requireNonNull(x, "x must not be null");
        RealMatrix xt = x.transpose();
        return x.multiply(pseudoInverse(xt.multiply(x))).multiply(xt);
    }

    /**
     * Gram pseudo-inverse (X'X)+, the reusable part of every projection onto X.
     */
    public static RealMatrix gramPseudoInverse(RealMatrix x) {
        Objects.requireNonNull(x, "x must not be null");
        return pseudoInverse(x.transpose().multiply(x));
    }

    /**
     * P Y computed as X ((X'X)+ (X'Y)), never materializing the n x n hat matrix.
     */
    public static RealMatrix fitted(RealMatrix x, RealMatrix y) {
        return fitted(x, gramPseudoInverse(x), y);
    }

    static RealMatrix fitted(RealMatrix x, RealMatrix gramPinv, RealMatrix y) {
        Objects.requireNonNull(y, "y must not be null");
        if (x.getRowDimension() != y.getRowDimension()) {
            throw new IllegalArgumentException(
                    "Row mismatch: design has " + x.getRowDimension() + " rows, response has " + y.getRowDimension()
            );
        }
        return x.multiply(gramPinv.multiply(x.transpose().multiply(y)));
    }

    /** Numerical rank of X. */
    public static int rank(RealMatrix x) {
        Objects.requireNonNull(x, "x must not be null");
        return new SingularValueDecomposition(x).getRank();
    }

    /**
     * trace(E'E), the sum of squares of every entry of E.
     */
    public static double traceOfCrossProduct(RealMatrix e) {
        Objects.requireNonNull(e, "e must not be null");
        double sum = 0.0;
        for (int i = 0; i < e.getRowDimension(); i++) {
            for (int j = 0; j < e.getColumnDimension(); j++) {
                double v = e.getEntry(i, j);
                sum += v * v;
            }
        }
        return sum;
    }
}
