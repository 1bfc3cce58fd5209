package org.wingshape.variance;

import org.wingshape.diagnostics.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type-III SSCP traces of one decomposition: one score per model term plus {@link #RESIDUALS}.
 *
 * For non-orthogonal designs the term scores and the residual do not add up to the total
 * SSCP trace of the response. Percentages are taken over their sum regardless.
 */
public final class SscpResult {

    public static final String RESIDUALS = "Residuals";

    private final Map<String, Double> scores;
    private final int rank;
    private final int columns;
    private final List<Diagnostic> diagnostics;

    public SscpResult(Map<String, Double> scores, int rank, int columns, List<Diagnostic> diagnostics) {
        Objects.requireNonNull(scores, "scores must not be null");
        if (!scores.containsKey(RESIDUALS)) {
            throw new IllegalArgumentException("scores must contain " + RESIDUALS);
        }
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            Double v = e.getValue();
            if (v == null || !Double.isFinite(v) || v < 0.0) {
                throw new IllegalArgumentException("Score for " + e.getKey() + " must be finite and non-negative: " + v);
            }
        }
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        this.rank = rank;
        this.columns = columns;
        this.diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics must not be null"));
    }

    /** Term -> trace, in design order, residual last. */
    public Map<String, Double> scores() {
        return scores;
    }

    public double score(String term) {
        Double v = scores.get(term);
        if (v == null) {
            throw new IllegalArgumentException("Unknown term: " + term);
        }
        return v;
    }

    public double residual() {
        return scores.get(RESIDUALS);
    }

    /** Sum of all scores, the residual included. */
    public double total() {
        double sum = 0.0;
        for (double v : scores.values()) sum += v;
        return sum;
    }

    /** Numerical rank of the full design. */
    public int rank() {
        return rank;
    }

    /** Rank a full-rank design would have (its column count). */
    public int expectedRank() {
        return columns;
    }

    public boolean rankDeficient() {
        return rank < columns;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * Each score as a percentage of {@link #total()}. A zero total gives 0 everywhere.
     */
    public Map<String, Double> percentages() {
        double total = total();
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            out.put(e.getKey(), total > 0.0 ? e.getValue() / total * 100.0 : 0.0);
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return "SscpResult" + scores;
    }
}
