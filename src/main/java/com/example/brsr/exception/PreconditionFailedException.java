package com.example.brsr.exception;

/**
 * A document cannot be processed at all (bad key, unknown company, empty catalog).
 * Never retried: redelivering the same task would fail the same way.
 */
public class PreconditionFailedException extends EsgPipelineException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
