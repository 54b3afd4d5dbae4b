package com.example.brsr.model;

import com.example.brsr.exception.MalformedModelOutputException;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Structured answer of the extraction model for a single indicator.
 * Construction fails with {@link MalformedModelOutputException} when the answer breaks the schema,
 * so a malformed answer never leaves the deserialization boundary.
 */
public record IndicatorExtractionOutput(
        @JsonPropertyDescription("BRSR indicator code being extracted")
        String indicatorCode,
        @JsonPropertyDescription("Value exactly as stated in the report, or \"Not Found\"")
        String value,
        @JsonPropertyDescription("Numeric representation of the value, null when the value is not numeric")
        Double numericValue,
        @JsonPropertyDescription("Unit of measurement as found in the report")
        String unit,
        @JsonPropertyDescription("Confidence between 0.0 and 1.0")
        Double confidence,
        @JsonPropertyDescription("Every page number the value was drawn from")
        List<Integer> sourcePages
) {
    public static final String NOT_FOUND = "Not Found";

    public IndicatorExtractionOutput {
        if (value == null || value.isBlank()) {
            throw new MalformedModelOutputException("Missing value for indicator " + indicatorCode);
        }
        if (confidence == null) {
            throw new MalformedModelOutputException("Missing confidence for indicator " + indicatorCode);
        }
        if (confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw new MalformedModelOutputException(
                    "Confidence " + confidence + " outside [0.0, 1.0] for indicator " + indicatorCode);
        }
        if (numericValue != null && (numericValue.isNaN() || numericValue.isInfinite())) {
            throw new MalformedModelOutputException("Non-finite numeric value for indicator " + indicatorCode);
        }
        List<Integer> pages = new ArrayList<>();
        if (sourcePages != null) {
            for (Integer page : new LinkedHashSet<>(sourcePages)) {
                if (page == null || page < 1) {
                    throw new MalformedModelOutputException(
                            "Invalid page number " + page + " for indicator " + indicatorCode);
                }
                pages.add(page);
            }
        }
        value = value.trim();
        sourcePages = List.copyOf(pages);
    }

    public boolean isNotFound() {
        return NOT_FOUND.equalsIgnoreCase(value);
    }

    /** Copy stamped with the catalog code, for answers that echo a different or empty code. */
    public IndicatorExtractionOutput withIndicatorCode(String code) {
        return new IndicatorExtractionOutput(code, value, numericValue, unit, confidence, sourcePages);
    }
}
