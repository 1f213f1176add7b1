package com.onevault.audit;

import java.util.List;

/**
 * Result of validating an {@link AuditEnvelope}.
 *
 * @param valid  true if validation passed with no errors
 * @param errors every problem found (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
