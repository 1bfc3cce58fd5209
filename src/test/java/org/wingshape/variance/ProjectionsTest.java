package org.wingshape.variance;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionsTest {

    private static void assertMatrixEquals(RealMatrix expected, RealMatrix actual, double tol) {
        assertEquals(expected.getRowDimension(), actual.getRowDimension());
        assertEquals(expected.getColumnDimension(), actual.getColumnDimension());
        for (int i = 0; i < expected.getRowDimension(); i++) {
            for (int j = 0; j < expected.getColumnDimension(); j++) {
                assertEquals(expected.getEntry(i, j), actual.getEntry(i, j), tol, "(" + i + "," + j + ")");
            }
        }
    }

    @Test
    void hat_isSymmetricAndIdempotent() {
        RealMatrix x = new Array2DRowRealMatrix(new double[][]{
                {1, 0.5}, {1, 1.5}, {1, 2.0}, {1, 4.0}, {1, -1.0}
        });
        RealMatrix p = Projections.hat(x);

        assertMatrixEquals(p, p.transpose(), 1e-12);
        assertMatrixEquals(p, p.multiply(p), 1e-12);
        // projecting X onto its own column space returns X
        assertMatrixEquals(x, p.multiply(x), 1e-12);
    }

    @Test
    void aliasedDesign_doesNotFail() {
        // third column duplicates the second
        RealMatrix x = new Array2DRowRealMatrix(new double[][]{
                {1, 1, 1}, {1, 0, 0}, {1, 1, 1}, {1, 0, 0}
        });
        RealMatrix aliasedFree = new Array2DRowRealMatrix(new double[][]{
                {1, 1}, {1, 0}, {1, 1}, {1, 0}
        });

        assertEquals(2, Projections.rank(x));
        assertMatrixEquals(Projections.hat(aliasedFree), Projections.hat(x), 1e-10);
    }

    @Test
    void fitted_matchesHatTimesResponse() {
        RealMatrix x = new Array2DRowRealMatrix(new double[][]{
                {1, 0, 0}, {1, 1, 0}, {1, 0, 1}, {1, 1, 1}, {1, 0, 0}, {1, 1, 1}
        });
        RealMatrix y = new Array2DRowRealMatrix(new double[][]{
                {0.2, 1.0}, {0.4, 0.0}, {0.9, -1.0}, {1.3, 2.0}, {0.1, 0.5}, {1.1, 1.5}
        });

        assertMatrixEquals(Projections.hat(x).multiply(y), Projections.fitted(x, y), 1e-12);
    }

    @Test
    void fitted_rowMismatch_throws() {
        RealMatrix x = MatrixUtils.createRealIdentityMatrix(3);
        RealMatrix y = new Array2DRowRealMatrix(2, 1);
        assertThrows(IllegalArgumentException.class, () -> Projections.fitted(x, y));
    }

    @Test
    void traceOfCrossProduct_isSumOfSquares() {
        RealMatrix e = new Array2DRowRealMatrix(new double[][]{{1, 2}, {-3, 0.5}});
        assertEquals(e.transpose().multiply(e).getTrace(), Projections.traceOfCrossProduct(e), 1e-12);
        assertEquals(14.25, Projections.traceOfCrossProduct(e), 1e-12);
    }
}
