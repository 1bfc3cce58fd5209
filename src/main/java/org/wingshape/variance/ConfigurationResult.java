package org.wingshape.variance;

import java.util.Objects;

/**
 * Decomposition of one response configuration (standardized features or a PC truncation).
 */
public record ConfigurationResult(String label, int dimensions, SscpResult sscp) {

    public ConfigurationResult {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must be non-empty");
        }
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be >= 1");
        }
        Objects.requireNonNull(sscp, "sscp must not be null");
    }
}
