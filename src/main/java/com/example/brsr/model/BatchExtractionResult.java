package com.example.brsr.model;

import java.util.List;

/**
 * Output of one batch extraction over a document.
 *
 * @param indicators           Successfully extracted indicators, all PENDING
 * @param attempted            Number of indicators the batch tried
 * @param failedIndicatorCodes Codes whose extraction failed and were left out
 */
public record BatchExtractionResult(
        DocumentKey documentKey,
        long companyId,
        List<ExtractedIndicator> indicators,
        int attempted,
        List<String> failedIndicatorCodes
) {
    public BatchExtractionResult {
        indicators = List.copyOf(indicators);
        failedIndicatorCodes = List.copyOf(failedIndicatorCodes);
    }
}
