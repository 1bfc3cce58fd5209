package org.wingshape.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered collection of specimens sharing one coefficient layout.
 */
public final class CoefficientStore {

    private final List<Specimen> specimens;
    private final Map<String, Specimen> byId;
    private final CoefficientMatrix matrix;

    public CoefficientStore(List<Specimen> specimens) {
        Objects.requireNonNull(specimens, "specimens must not be null");
        if (specimens.isEmpty()) throw new IllegalArgumentException("CoefficientStore cannot be empty");

        this.specimens = List.copyOf(specimens);

        Map<String, Specimen> index = new LinkedHashMap<>();
        for (Specimen s : this.specimens) {
            if (index.putIfAbsent(s.id(), s) != null) {
                throw new IllegalArgumentException("Duplicate specimen id: " + s.id());
            }
        }
        this.byId = Collections.unmodifiableMap(index);

        // Also enforces one layout across all rows
        this.matrix = CoefficientMatrix.of(this.specimens);
    }

    public int size() {
        return specimens.size();
    }

    public List<Specimen> specimens() {
        return specimens;
    }

    public Specimen get(int row) {
        return specimens.get(row);
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public Optional<Specimen> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Specimen require(String id) {
        return find(id).orElseThrow(() ->
                new IllegalArgumentException("Unknown id: " + id)
        );
    }

    /** Identifiers in row order. */
    public Set<String> ids() {
        return byId.keySet();
    }

    public CoefficientLayout layout() {
        return matrix.layout();
    }

    public CoefficientMatrix matrix() {
        return matrix;
    }

    public List<String> speciesLabels() {
        List<String> out = new ArrayList<>(specimens.size());
        for (Specimen s : specimens) out.add(s.species());
        return List.copyOf(out);
    }

    public List<String> sexLabels() {
        List<String> out = new ArrayList<>(specimens.size());
        for (Specimen s : specimens) out.add(s.sex());
        return List.copyOf(out);
    }

    /**
     * Specimens bucketed by species x sex, groups in first-appearance order.
     */
    public Map<GroupKey, List<Specimen>> groups() {
        Map<GroupKey, List<Specimen>> out = new LinkedHashMap<>();
        for (Specimen s : specimens) {
            out.computeIfAbsent(s.groupKey(), k -> new ArrayList<>()).add(s);
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(out);
    }

    /**
     * Builds a new store with the same ids and metadata but replaced coefficients.
     *
     * @param replacements one coefficient set per row, in row order
     */
    public CoefficientStore withCoefficients(List<HarmonicCoefficients> replacements) {
        Objects.requireNonNull(replacements, "replacements must not be null");
        if (replacements.size() != specimens.size()) {
            throw new IllegalArgumentException(
                    "Expected " + specimens.size() + " coefficient sets but got " + replacements.size()
            );
        }
        List<Specimen> out = new ArrayList<>(specimens.size());
        for (int i = 0; i < specimens.size(); i++) {
            out.add(specimens.get(i).withCoefficients(replacements.get(i)));
        }
        return new CoefficientStore(out);
    }
}
