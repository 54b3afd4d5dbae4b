package com.example.brsr.exception;

/**
 * An operation kept failing until the retry policy gave up.
 */
public class IndicatorExtractionException extends EsgPipelineException {

    private final int attempts;

    public IndicatorExtractionException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
