package com.example.brsr.exception;

/**
 * Base type for every failure raised by the extraction pipeline.
 */
public class EsgPipelineException extends RuntimeException {

    public EsgPipelineException(String message) {
        super(message);
    }

    public EsgPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
