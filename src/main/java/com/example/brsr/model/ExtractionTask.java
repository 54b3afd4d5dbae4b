package com.example.brsr.model;

/**
 * One delivery of an extraction task.
 *
 * @param deliveryAttempt  How many times the task already failed and was redelivered
 * @param embeddingChecks  How many times the task was requeued waiting for embeddings
 */
public record ExtractionTask(String documentKey, int deliveryAttempt, int embeddingChecks) {

    public static ExtractionTask firstDelivery(String documentKey) {
        return new ExtractionTask(documentKey, 0, 0);
    }
}
