package org.wingshape.model;

import java.util.Objects;

/**
 * One wing specimen: identifier, categorical metadata and its EFD coefficients.
 */
public record Specimen(String id, String species, String sex, HarmonicCoefficients coefficients) {

    public Specimen {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be non-empty");
        }
        if (species == null || species.isBlank()) {
            throw new IllegalArgumentException("species must be non-empty for id: " + id);
        }
        if (sex == null || sex.isBlank()) {
            throw new IllegalArgumentException("sex must be non-empty for id: " + id);
        }
        Objects.requireNonNull(coefficients, "coefficients must not be null");
    }

    public GroupKey groupKey() {
        return new GroupKey(species, sex);
    }

    /**
     * Returns a copy carrying other coefficients; this specimen is left untouched.
     */
    public Specimen withCoefficients(HarmonicCoefficients replacement) {
        return new Specimen(id, species, sex, replacement);
    }
}
