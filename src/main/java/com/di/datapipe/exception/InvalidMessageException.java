package com.di.datapipe.exception;

/**
 * Message body that cannot be decoded into the expected payload.
 */
public class InvalidMessageException extends PipelineException {

    public InvalidMessageException(String message) {
        super(FailureCategory.INVALID_MESSAGE, message);
    }

    public InvalidMessageException(String message, Throwable cause) {
        super(FailureCategory.INVALID_MESSAGE, message, cause);
    }
}
