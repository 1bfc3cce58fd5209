package org.wingshape.contour;

import java.util.List;
import java.util.Objects;

/**
 * Ordered closed-polygon approximation of a wing outline. The first and last points
 * coincide up to floating-point error because sampling spans one full period.
 */
public record Contour(List<Point2D> points) {

    public Contour {
        Objects.requireNonNull(points, "points must not be null");
        if (points.size() < 2) {
            throw new IllegalArgumentException("A contour needs at least two points but got " + points.size());
        }
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public Point2D get(int i) {
        return points.get(i);
    }

    public double[] xs() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) out[i] = points.get(i).x();
        return out;
    }

    public double[] ys() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) out[i] = points.get(i).y();
        return out;
    }
}
