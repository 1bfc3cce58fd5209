package org.wingshape.io;

import org.wingshape.model.CoefficientLayout;
import org.wingshape.model.CoefficientStore;

/**
 * A single coefficient input:
 * - which coefficient layout it is read with
 * - where its data comes from (file/stream/etc.)
 *
 * Implementations should:
 * - load rows once (and optionally cache)
 * - validate rows (missing columns, unparseable coefficients, blank metadata)
 * - preserve the row order of the input
 */
public interface CoefficientSource {

    /**
     * The layout (H and symbols) every row is expected to follow.
     */
    CoefficientLayout layout();

    /**
     * Loads (or returns cached) specimens.
     *
     * @throws org.wingshape.diagnostics.DataFormatException if the input is malformed
     */
    CoefficientStore load();

    /**
     * Human-readable origin, used in log and error messages.
     */
    String description();
}
