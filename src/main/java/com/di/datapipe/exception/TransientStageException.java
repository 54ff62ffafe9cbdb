package com.di.datapipe.exception;

/**
 * Fetch, landing or publish failure expected to clear on redelivery.
 */
public class TransientStageException extends PipelineException {

    public TransientStageException(String message) {
        super(FailureCategory.TRANSIENT, message);
    }

    public TransientStageException(String message, Throwable cause) {
        super(FailureCategory.TRANSIENT, message, cause);
    }
}
