package org.wingshape.variance;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wingshape.diagnostics.Diagnostic;
import org.wingshape.diagnostics.NumericCondition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type-III SSCP decomposition of a multivariate response over one fixed design.
 *
 * For each term the marginal contribution is the difference between the fitted values of the
 * full design and of the design without that term's columns; its score is trace(E'E).
 * The Gram pseudo-inverses depend only on the design and are computed once, so one instance
 * can decompose any number of responses, from several threads.
 */
public final class TypeIIIDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TypeIIIDecomposer.class);

    private final DesignMatrix design;
    private final RealMatrix full;
    private final RealMatrix fullGramPinv;
    private final List<Reduced> reduced;
    private final int rank;

    public TypeIIIDecomposer(DesignMatrix design) {
        this.design = Objects.requireNonNull(design, "design must not be null");
        this.full = design.matrix();
        this.fullGramPinv = Projections.gramPseudoInverse(full);
        this.rank = Projections.rank(full);

        List<Reduced> out = new ArrayList<>();
        for (TermSlice slice : design.testableSlices()) {
            RealMatrix x = design.without(slice);
            out.add(new Reduced(slice.term(), x, Projections.gramPseudoInverse(x)));
        }
        this.reduced = List.copyOf(out);

        if (rank < design.columns()) {
            log.warn("Design has rank {} but {} columns; collinear columns are absorbed by the pseudo-inverse",
                    rank, design.columns());
        }
    }

    public DesignMatrix design() {
        return design;
    }

    public SscpResult decompose(double[][] response, String subject) {
        Objects.requireNonNull(response, "response must not be null");
        return decompose(new Array2DRowRealMatrix(response, true), subject);
    }

    /**
     * @param y samples x response dimensions (raw coefficients or retained PC scores), rows
     *          in the same order as the design
     * @param subject label used in diagnostics and logs
     */
    public SscpResult decompose(RealMatrix y, String subject) {
        Objects.requireNonNull(y, "y must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        if (y.getRowDimension() != design.rows()) {
            throw new IllegalArgumentException(
                    "Response has " + y.getRowDimension() + " rows but the design has " + design.rows()
            );
        }

        RealMatrix fullFit = Projections.fitted(full, fullGramPinv, y);

        Map<String, Double> scores = new LinkedHashMap<>();
        for (Reduced r : reduced) {
            RealMatrix reducedFit = Projections.fitted(r.matrix, r.gramPinv, y);
            RealMatrix effect = fullFit.subtract(reducedFit);
            double score = Projections.traceOfCrossProduct(effect);
            scores.put(r.term, score);
            log.debug("[{}] {} = {}", subject, r.term, score);
        }
        double residual = Projections.traceOfCrossProduct(y.subtract(fullFit));
        scores.put(SscpResult.RESIDUALS, residual);
        log.debug("[{}] {} = {}", subject, SscpResult.RESIDUALS, residual);

        List<Diagnostic> diagnostics = new ArrayList<>();
        if (rank < design.columns()) {
            diagnostics.add(new Diagnostic(subject, NumericCondition.RANK_DEFICIENT,
                    "rank " + rank + " of " + design.columns() + " columns"));
        }
        return new SscpResult(scores, rank, design.columns(), diagnostics);
    }

    private record Reduced(String term, RealMatrix matrix, RealMatrix gramPinv) { }
}
