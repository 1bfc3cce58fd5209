package org.wingshape.variance;

/**
 * Contiguous column range [start, end) of a design matrix owned by one model term.
 */
public record TermSlice(String term, int start, int end) {

    public TermSlice {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("term must be non-empty");
        }
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid column range [" + start + ", " + end + ") for term " + term);
        }
    }

    public int width() {
        return end - start;
    }

    public boolean contains(int column) {
        return column >= start && column < end;
    }
}
