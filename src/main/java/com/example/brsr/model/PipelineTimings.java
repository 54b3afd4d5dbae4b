package com.example.brsr.model;

/**
 * Per-stage timing of one document run (in seconds).
 *
 * @param extractionSeconds  Retrieval and model calls for every indicator
 * @param validationSeconds  Validator pass over the batch
 * @param persistenceSeconds Indicator transaction
 * @param scoringSeconds     Score calculation and score upsert
 */
public record PipelineTimings(
        double extractionSeconds,
        double validationSeconds,
        double persistenceSeconds,
        double scoringSeconds
) {
    public static final PipelineTimings NONE = new PipelineTimings(0, 0, 0, 0);

    public double totalSeconds() {
        return extractionSeconds + validationSeconds + persistenceSeconds + scoringSeconds;
    }
}
