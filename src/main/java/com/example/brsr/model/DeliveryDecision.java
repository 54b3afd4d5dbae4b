package com.example.brsr.model;

/**
 * What the transport layer should do with a task after handling it.
 */
public record DeliveryDecision(Action action, String reason, DocumentRunSummary summary) {

    public enum Action {
        /** Done, remove from the queue. */
        ACK,
        /** Deliver again later. */
        REQUEUE,
        /** Move to the dead-letter queue for manual inspection. */
        PARK
    }

    public static DeliveryDecision ack(DocumentRunSummary summary) {
        return new DeliveryDecision(Action.ACK, "processed", summary);
    }

    public static DeliveryDecision requeue(String reason) {
        return new DeliveryDecision(Action.REQUEUE, reason, null);
    }

    public static DeliveryDecision park(String reason) {
        return new DeliveryDecision(Action.PARK, reason, null);
    }
}
