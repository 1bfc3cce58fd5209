package org.wingshape.diagnostics;

import java.util.Objects;

/**
 * A numeric condition met while processing one unit (a specimen or a decomposition).
 *
 * @param subject what was being processed (specimen id, configuration label)
 * @param condition which condition
 * @param detail free text with the offending numbers
 */
public record Diagnostic(String subject, NumericCondition condition, String detail) {

    public Diagnostic {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public String toString() {
        return subject + ": " + condition.fallback() + " (" + detail + ")";
    }
}
