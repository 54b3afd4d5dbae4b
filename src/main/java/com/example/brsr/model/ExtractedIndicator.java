package com.example.brsr.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Result of one extraction attempt for one indicator of one document.
 * Only {@link #validationStatus()} ever changes after creation, and only away from PENDING.
 *
 * @param documentKey     Object key of the source PDF (e.g. RELIANCE/2024_BRSR.pdf)
 * @param extractedValue  Raw text value as returned by the model
 * @param numericValue    Parsed numeric value, {@code null} for qualitative answers
 * @param confidenceScore Model confidence in [0.0, 1.0]
 * @param sourcePages     Cited page numbers, in the order the model returned them
 * @param sourceChunkIds  Chunk ids resolved from the cited pages
 */
@Document(collection = "extracted_indicators")
@CompoundIndex(name = "document_indicator", def = "{'documentKey': 1, 'indicatorCode': 1}", unique = true)
public record ExtractedIndicator(
        @Id String id,
        String documentKey,
        long companyId,
        int reportYear,
        String indicatorCode,
        String extractedValue,
        Double numericValue,
        double confidenceScore,
        ValidationStatus validationStatus,
        List<Integer> sourcePages,
        List<String> sourceChunkIds,
        Instant extractedAt
) {
    public ExtractedIndicator {
        sourcePages = sourcePages != null ? List.copyOf(sourcePages) : List.of();
        sourceChunkIds = sourceChunkIds != null ? List.copyOf(sourceChunkIds) : List.of();
        if (validationStatus == null) validationStatus = ValidationStatus.PENDING;
    }

    /** Fresh, not yet validated result. */
    public static ExtractedIndicator pending(String documentKey, long companyId, int reportYear,
                                             String indicatorCode, String extractedValue, Double numericValue,
                                             double confidenceScore, List<Integer> sourcePages,
                                             List<String> sourceChunkIds, Instant extractedAt) {
        return new ExtractedIndicator(null, documentKey, companyId, reportYear, indicatorCode,
                extractedValue, numericValue, confidenceScore, ValidationStatus.PENDING,
                sourcePages, sourceChunkIds, extractedAt);
    }

    /**
     * Applies a validation verdict. Re-applying the same verdict is a no-op;
     * changing a verdict that was already applied is rejected.
     */
    public ExtractedIndicator withValidationStatus(ValidationStatus newStatus) {
        if (newStatus == ValidationStatus.PENDING) {
            throw new IllegalArgumentException("Cannot move " + indicatorCode + " back to PENDING");
        }
        if (validationStatus != ValidationStatus.PENDING && validationStatus != newStatus) {
            throw new IllegalStateException("Indicator " + indicatorCode + " already validated as "
                    + validationStatus);
        }
        return new ExtractedIndicator(id, documentKey, companyId, reportYear, indicatorCode,
                extractedValue, numericValue, confidenceScore, newStatus,
                sourcePages, sourceChunkIds, extractedAt);
    }

    public boolean isScorable() {
        return validationStatus == ValidationStatus.VALID && numericValue != null;
    }
}
