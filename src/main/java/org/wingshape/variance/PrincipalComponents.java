package org.wingshape.variance;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;
import java.util.Objects;

/**
 * Principal component analysis of a samples x features matrix, by SVD of the centered data.
 * Components are ordered by decreasing explained variance.
 */
public final class PrincipalComponents {

    private final RealMatrix scores;
    private final RealMatrix loadings;
    private final double[] explainedVariance;
    private final double[] explainedVarianceRatio;

    private PrincipalComponents(RealMatrix scores, RealMatrix loadings, double[] explainedVariance,
                                double[] explainedVarianceRatio) {
        this.scores = scores;
        this.loadings = loadings;
        this.explainedVariance = explainedVariance;
        this.explainedVarianceRatio = explainedVarianceRatio;
    }

    /**
     * Column-wise z-scores using the population standard deviation (divisor n).
     * Constant columns are centered and left unscaled.
     */
    public static RealMatrix standardize(RealMatrix data) {
        Objects.requireNonNull(data, "data must not be null");
        RealMatrix out = data.copy();
        StandardDeviation populationSd = new StandardDeviation(false);
        Mean mean = new Mean();
        for (int j = 0; j < data.getColumnDimension(); j++) {
            double[] col = data.getColumn(j);
            double mu = mean.evaluate(col);
            double sd = populationSd.evaluate(col);
            double scale = sd > 0.0 ? sd : 1.0;
            for (int i = 0; i < col.length; i++) {
                out.setEntry(i, j, (col[i] - mu) / scale);
            }
        }
        return out;
    }

    public static PrincipalComponents fit(RealMatrix data) {
        Objects.requireNonNull(data, "data must not be null");
        int n = data.getRowDimension();
        if (n < 2) {
            throw new IllegalArgumentException("PCA needs at least two samples but got " + n);
        }

        RealMatrix centered = data.copy();
        Mean mean = new Mean();
        for (int j = 0; j < data.getColumnDimension(); j++) {
            double mu = mean.evaluate(data.getColumn(j));
            for (int i = 0; i < n; i++) {
                centered.setEntry(i, j, centered.getEntry(i, j) - mu);
            }
        }

        SingularValueDecomposition svd = new SingularValueDecomposition(centered);
        double[] s = svd.getSingularValues();
        RealMatrix v = svd.getV();

        double[] variance = new double[s.length];
        double sumSq = 0.0;
        for (int k = 0; k < s.length; k++) {
            variance[k] = s[k] * s[k] / (n - 1);
            sumSq += s[k] * s[k];
        }
        double[] ratio = new double[s.length];
        for (int k = 0; k < s.length; k++) {
            ratio[k] = sumSq > 0.0 ? s[k] * s[k] / sumSq : 0.0;
        }

        return new PrincipalComponents(centered.multiply(v), v, variance, ratio);
    }

    /** Number of components available (min(samples, features)). */
    public int componentCount() {
        return explainedVariance.length;
    }

    /**
     * Scores on the first k components.
     */
    public RealMatrix scores(int k) {
        if (k <= 0 || k > componentCount()) {
            throw new IllegalArgumentException("k must be in [1, " + componentCount() + "] but was " + k);
        }
        return scores.getSubMatrix(0, scores.getRowDimension() - 1, 0, k - 1);
    }

    /** Feature loadings, one column per component. */
    public RealMatrix loadings() {
        return loadings.copy();
    }

    public double[] explainedVariance() {
        return Arrays.copyOf(explainedVariance, explainedVariance.length);
    }

    public double[] explainedVarianceRatio() {
        return Arrays.copyOf(explainedVarianceRatio, explainedVarianceRatio.length);
    }

    /** Fraction of the total variance carried by the first k components. */
    public double cumulativeRatio(int k) {
        if (k <= 0 || k > componentCount()) {
            throw new IllegalArgumentException("k must be in [1, " + componentCount() + "] but was " + k);
        }
        double sum = 0.0;
        for (int i = 0; i < k; i++) sum += explainedVarianceRatio[i];
        return sum;
    }
}
