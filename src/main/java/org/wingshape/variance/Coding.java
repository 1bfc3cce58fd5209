package org.wingshape.variance;

/**
 * How a categorical factor is turned into design columns. The first (sorted) level is the
 * reference for treatment coding; the last level is the negative pole for sum coding.
 */
public enum Coding {

    /** 0/1 dummy per non-reference level. */
    TREATMENT,

    /** +1 for the level, -1 for the last level, 0 otherwise. Orthogonal in balanced designs. */
    SUM
}
