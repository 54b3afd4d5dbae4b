package com.example.brsr.model;

/**
 * Parsed form of a document object key such as {@code RELIANCE/2024_BRSR.pdf}.
 */
public record DocumentKey(
        String objectKey,
        String companyName,
        int reportYear,
        String reportType,
        String extension
) {
    @Override
    public String toString() {
        return objectKey;
    }
}
