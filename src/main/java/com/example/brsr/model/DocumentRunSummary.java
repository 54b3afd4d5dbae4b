package com.example.brsr.model;

import java.util.List;

/**
 * What happened to a document during one pipeline run.
 *
 * @param outcome        PROCESSED, or SKIPPED when indicators already existed for the document
 * @param score          Stored score record, {@code null} when nothing was extracted
 */
public record DocumentRunSummary(
        String documentKey,
        Outcome outcome,
        int attempted,
        int extracted,
        int valid,
        int invalid,
        int persisted,
        List<String> failedIndicatorCodes,
        ScoreRecord score,
        PipelineTimings timings,
        long inputTokens,
        long outputTokens
) {
    public enum Outcome {
        PROCESSED,
        SKIPPED
    }

    public DocumentRunSummary {
        failedIndicatorCodes = failedIndicatorCodes != null ? List.copyOf(failedIndicatorCodes) : List.of();
    }

    public static DocumentRunSummary skipped(String documentKey) {
        return new DocumentRunSummary(documentKey, Outcome.SKIPPED, 0, 0, 0, 0, 0, List.of(), null,
                PipelineTimings.NONE, 0, 0);
    }
}
