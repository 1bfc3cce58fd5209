package org.wingshape.normalize;

import org.wingshape.diagnostics.Diagnostic;
import org.wingshape.model.Specimen;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of normalizing one specimen.
 *
 * @param specimen copy of the input specimen with size-invariant coefficients
 * @param semiMajorAxis the divisor p actually used (1 when the specimen had zero size)
 * @param diagnostics numeric conditions resolved on the way (empty in the common case)
 */
public record NormalizationResult(Specimen specimen, double semiMajorAxis, List<Diagnostic> diagnostics) {

    public NormalizationResult {
        Objects.requireNonNull(specimen, "specimen must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        diagnostics = List.copyOf(diagnostics);
    }
}
