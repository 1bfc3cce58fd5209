package org.wingshape.model;

import java.util.Objects;

/**
 * Species x sex cell used to bucket specimens.
 */
public record GroupKey(String species, String sex) {

    public GroupKey {
        Objects.requireNonNull(species, "species must not be null");
        Objects.requireNonNull(sex, "sex must not be null");
    }

    @Override
    public String toString() {
        return species + " / " + sex;
    }
}
