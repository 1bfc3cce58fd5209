package org.wingshape.diagnostics;

/**
 * Recoverable numeric edge cases. Each one is resolved locally by a fixed fallback.
 */
public enum NumericCondition {

    /** Zero-size specimen: semi-major axis was 0 and 1 is used instead. */
    DEGENERATE_GEOMETRY("zero semi-major axis, scale factor 1 used"),

    /**
     * Largest eigenvalue came out negative: its absolute value is used. M = T T' is positive
     * semi-definite, so only round-off in the eigen solver can produce this.
     */
    NEGATIVE_EIGENVALUE("negative largest eigenvalue, absolute value used"),

    /** Collinear design columns: the pseudo-inverse is used. */
    RANK_DEFICIENT("rank-deficient design, pseudo-inverse used");

    private final String fallback;

    NumericCondition(String fallback) {
        this.fallback = fallback;
    }

    public String fallback() {
        return fallback;
    }
}
