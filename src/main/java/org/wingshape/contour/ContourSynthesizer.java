package org.wingshape.contour;

import org.wingshape.model.CoefficientLayout;
import org.wingshape.model.CoefficientStore;
import org.wingshape.model.GroupKey;
import org.wingshape.model.HarmonicCoefficients;
import org.wingshape.model.Specimen;
import org.wingshape.model.Vector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds outlines from truncated elliptical Fourier series:
 *
 *   x(t) = sum_n a_n cos(nt) + b_n sin(nt)
 *   y(t) = sum_n c_n cos(nt) + d_n sin(nt)
 *
 * sampled at t_i = 2 pi i / (numPoints - 1), i = 0..numPoints-1.
 * Stateless; safe to share.
 */
public final class ContourSynthesizer {

    public Contour reconstruct(HarmonicCoefficients coefficients, int numPoints) {
        Objects.requireNonNull(coefficients, "coefficients must not be null");
        requirePoints(numPoints);

        int h = coefficients.harmonics();
        double[] a = new double[h];
        double[] b = new double[h];
        double[] c = new double[h];
        double[] d = new double[h];
        for (int n = 1; n <= h; n++) {
            a[n - 1] = coefficients.a(n);
            b[n - 1] = coefficients.b(n);
            c[n - 1] = coefficients.c(n);
            d[n - 1] = coefficients.d(n);
        }
        return synthesize(a, b, c, d, numPoints);
    }

    /**
     * Sparse entry point keyed by column name ("a1", "d7", ...). Absent harmonics contribute nothing;
     * keys outside the layout are ignored.
     */
    public Contour reconstruct(Map<String, Double> coefficients, CoefficientLayout layout, int numPoints) {
        Objects.requireNonNull(coefficients, "coefficients must not be null");
        Objects.requireNonNull(layout, "layout must not be null");
        requirePoints(numPoints);

        int h = layout.harmonics();
        double[][] families = new double[4][h];
        for (int family = CoefficientLayout.A; family <= CoefficientLayout.D; family++) {
            for (int n = 1; n <= h; n++) {
                Double v = coefficients.get(layout.columnName(layout.indexOf(family, n)));
                families[family][n - 1] = v == null ? 0.0 : v;
            }
        }
        return synthesize(families[CoefficientLayout.A], families[CoefficientLayout.B],
                families[CoefficientLayout.C], families[CoefficientLayout.D], numPoints);
    }

    /**
     * Pointwise mean of contours sampled identically (same numPoints and parametrization).
     */
    public Contour groupMean(Collection<Contour> contours) {
        if (contours == null || contours.isEmpty()) {
            throw new IllegalArgumentException("contours must not be empty");
        }
        int size = contours.iterator().next().size();
        List<Vector> xs = new ArrayList<>(contours.size());
        List<Vector> ys = new ArrayList<>(contours.size());
        for (Contour c : contours) {
            if (c.size() != size) {
                throw new IllegalArgumentException(
                        "Contours must share one sampling: expected " + size + " points but got " + c.size()
                );
            }
            xs.add(new Vector(c.xs()));
            ys.add(new Vector(c.ys()));
        }
        Vector meanX = Vector.average(xs);
        Vector meanY = Vector.average(ys);

        List<Point2D> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(new Point2D(meanX.get(i), meanY.get(i)));
        }
        return new Contour(out);
    }

    /**
     * Mean contour of every species x sex group, in the store's first-appearance order.
     */
    public Map<GroupKey, Contour> groupMeanContours(CoefficientStore store, int numPoints) {
        Objects.requireNonNull(store, "store must not be null");
        requirePoints(numPoints);

        Map<GroupKey, Contour> out = new LinkedHashMap<>();
        for (Map.Entry<GroupKey, List<Specimen>> group : store.groups().entrySet()) {
            List<Contour> members = new ArrayList<>(group.getValue().size());
            for (Specimen s : group.getValue()) {
                members.add(reconstruct(s.coefficients(), numPoints));
            }
            out.put(group.getKey(), groupMean(members));
        }
        return Collections.unmodifiableMap(out);
    }

    private static Contour synthesize(double[] a, double[] b, double[] c, double[] d, int numPoints) {
        List<Point2D> points = new ArrayList<>(numPoints);
        for (int i = 0; i < numPoints; i++) {
            double t = 2.0 * Math.PI * i / (numPoints - 1);
            double x = 0.0;
            double y = 0.0;
            for (int n = 1; n <= a.length; n++) {
                double cos = Math.cos(n * t);
                double sin = Math.sin(n * t);
                x += a[n - 1] * cos + b[n - 1] * sin;
                y += c[n - 1] * cos + d[n - 1] * sin;
            }
            points.add(new Point2D(x, y));
        }
        return new Contour(points);
    }

    private static void requirePoints(int numPoints) {
        if (numPoints < 2) {
            throw new IllegalArgumentException("numPoints must be >= 2");
        }
    }
}
