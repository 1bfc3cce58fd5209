package org.wingshape.normalize;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wingshape.diagnostics.DataFormatException;
import org.wingshape.diagnostics.Diagnostic;
import org.wingshape.diagnostics.NumericCondition;
import org.wingshape.model.CoefficientStore;
import org.wingshape.model.HarmonicCoefficients;
import org.wingshape.model.Specimen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Makes EFD coefficients size-invariant by dividing them by the semi-major axis of the
 * first-harmonic ellipse.
 *
 * With T = [[a1, b1], [c1, d1]] and M = T T', the semi-major axis is p = sqrt(|lambda_max(M)|).
 * Scaling every coefficient by k scales p by k, so the result does not depend on the input size.
 */
public final class SizeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SizeNormalizer.class);

    private final boolean parallel;

    public SizeNormalizer() {
        this(false);
    }

    /**
     * @param parallel whether {@link #normalizeAll(CoefficientStore)} may spread specimens over threads
     */
    public SizeNormalizer(boolean parallel) {
        this.parallel = parallel;
    }

    public NormalizationResult normalize(Specimen specimen) {
        Objects.requireNonNull(specimen, "specimen must not be null");
        HarmonicCoefficients c = specimen.coefficients();

        double a1 = c.a(1);
        double b1 = c.b(1);
        double c1 = c.c(1);
        double d1 = c.d(1);
        if (!Double.isFinite(a1) || !Double.isFinite(b1) || !Double.isFinite(c1) || !Double.isFinite(d1)) {
            throw new DataFormatException("specimen " + specimen.id(),
                    "first-harmonic coefficients are missing or not finite: "
                            + Arrays.toString(new double[]{a1, b1, c1, d1}));
        }

        List<Diagnostic> diagnostics = new ArrayList<>(0);
        double p = semiMajorAxis(specimen.id(), a1, b1, c1, d1, diagnostics);

        for (Diagnostic d : diagnostics) {
            log.warn("{}", d);
        }
        return new NormalizationResult(specimen.withCoefficients(c.divided(p)), p, diagnostics);
    }

    /**
     * Normalizes every specimen of the store; rows keep their order.
     */
    public NormalizedDataset normalizeAll(CoefficientStore store) {
        Objects.requireNonNull(store, "store must not be null");

        NormalizationResult[] slots = new NormalizationResult[store.size()];
        IntStream rows = IntStream.range(0, slots.length);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(i -> slots[i] = normalize(store.get(i)));

        List<HarmonicCoefficients> coefficients = new ArrayList<>(slots.length);
        double[] axes = new double[slots.length];
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (int i = 0; i < slots.length; i++) {
            coefficients.add(slots[i].specimen().coefficients());
            axes[i] = slots[i].semiMajorAxis();
            diagnostics.addAll(slots[i].diagnostics());
        }

        log.info("Normalized {} specimens ({} numeric conditions)", slots.length, diagnostics.size());
        return new NormalizedDataset(store.withCoefficients(coefficients), axes, diagnostics);
    }

    /**
     * p = sqrt(|lambda_max(T T')|), with p = 1 substituted for a zero-size ellipse.
     * T is divided by its largest absolute entry before M is formed, so M can neither
     * overflow nor underflow for any finite first harmonic.
     */
    static double semiMajorAxis(String subject, double a1, double b1, double c1, double d1,
                                List<Diagnostic> diagnostics) {
        double s = Math.max(Math.max(Math.abs(a1), Math.abs(b1)), Math.max(Math.abs(c1), Math.abs(d1)));
        if (s == 0.0) {
            return axisFromEigenvalue(subject, 0.0, 1.0, diagnostics);
        }
        RealMatrix t = new Array2DRowRealMatrix(new double[][]{
                {a1 / s, b1 / s},
                {c1 / s, d1 / s}
        }, false);
        RealMatrix m = t.multiply(t.transpose());

        double[] eigenvalues = new EigenDecomposition(m).getRealEigenvalues();
        double lambdaMax = Double.NEGATIVE_INFINITY;
        for (double v : eigenvalues) {
            lambdaMax = Math.max(lambdaMax, v);
        }
        return axisFromEigenvalue(subject, lambdaMax, s, diagnostics);
    }

    /**
     * p = scale * sqrt(|lambdaMax|), where lambdaMax belongs to (T/scale)(T/scale)'.
     * Records a diagnostic for a negative eigenvalue and for a zero axis.
     */
    static double axisFromEigenvalue(String subject, double lambdaMax, double scale, List<Diagnostic> diagnostics) {
        if (lambdaMax < 0.0) {
            diagnostics.add(new Diagnostic(subject, NumericCondition.NEGATIVE_EIGENVALUE,
                    "lambda_max=" + lambdaMax));
        }
        double p = scale * Math.sqrt(Math.abs(lambdaMax));
        if (p == 0.0) {
            diagnostics.add(new Diagnostic(subject, NumericCondition.DEGENERATE_GEOMETRY,
                    "first harmonic is all zero"));
            return 1.0;
        }
        return p;
    }
}
