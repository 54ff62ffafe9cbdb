package com.di.datapipe.exception;

/**
 * Thrown when a load job rejects the landed content. Deterministic for unchanged content,
 * so a redelivery repeats the same failure.
 */
public class MalformedInputException extends PipelineException {

    public MalformedInputException(String message) {
        super(FailureCategory.MALFORMED_INPUT, message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(FailureCategory.MALFORMED_INPUT, message, cause);
    }
}
