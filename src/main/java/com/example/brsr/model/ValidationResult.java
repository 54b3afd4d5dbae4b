package com.example.brsr.model;

import java.util.List;

/**
 * Verdict for one extracted indicator. Errors make it INVALID, warnings never do.
 */
public record ValidationResult(
        boolean isValid,
        ValidationStatus status,
        List<String> errors,
        List<String> warnings
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        boolean valid = errors.isEmpty();
        return new ValidationResult(valid, valid ? ValidationStatus.VALID : ValidationStatus.INVALID,
                errors, warnings);
    }
}
