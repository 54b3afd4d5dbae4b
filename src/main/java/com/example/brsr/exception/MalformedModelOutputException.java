package com.example.brsr.exception;

/**
 * The model answered, but the answer does not fit the extraction schema.
 * Treated as transient: a second call usually produces a well-formed answer.
 */
public class MalformedModelOutputException extends EsgPipelineException {

    public MalformedModelOutputException(String message) {
        super(message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
