package org.wingshape.contour;

/**
 * A contour vertex.
 */
public record Point2D(double x, double y) {
}
