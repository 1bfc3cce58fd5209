package org.wingshape.normalize;

import org.wingshape.diagnostics.Diagnostic;
import org.wingshape.model.CoefficientStore;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Size-normalized copy of a whole store. Row order and metadata are those of the input.
 */
public final class NormalizedDataset {

    private final CoefficientStore store;
    private final double[] semiMajorAxes;
    private final List<Diagnostic> diagnostics;

    public NormalizedDataset(CoefficientStore store, double[] semiMajorAxes, List<Diagnostic> diagnostics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(semiMajorAxes, "semiMajorAxes must not be null");
        if (semiMajorAxes.length != store.size()) {
            throw new IllegalArgumentException(
                    "Expected " + store.size() + " semi-major axes but got " + semiMajorAxes.length
            );
        }
        this.semiMajorAxes = Arrays.copyOf(semiMajorAxes, semiMajorAxes.length);
        this.diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics must not be null"));
    }

    public CoefficientStore store() {
        return store;
    }

    /** Divisor used for the specimen at the given row. */
    public double semiMajorAxis(int row) {
        return semiMajorAxes[row];
    }

    public double[] semiMajorAxes() {
        return Arrays.copyOf(semiMajorAxes, semiMajorAxes.length);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
