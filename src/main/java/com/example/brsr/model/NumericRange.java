package com.example.brsr.model;

/**
 * Plausible range for an indicator's numeric value. A {@code null} bound means unbounded.
 */
public record NumericRange(Double min, Double max, boolean allowZero) {

    public static final NumericRange NON_NEGATIVE = new NumericRange(0.0, null, true);
    public static final NumericRange PERCENTAGE = new NumericRange(0.0, 100.0, true);
}
