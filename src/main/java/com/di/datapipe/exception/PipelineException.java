package com.di.datapipe.exception;

/**
 * Base class for stage failures. Carries the {@link FailureCategory} that the bus uses to decide
 * between redelivery and dead-lettering.
 */
public class PipelineException extends RuntimeException {

    private final FailureCategory category;

    public PipelineException(FailureCategory category, String message) {
        super(message);
        this.category = category;
    }

    public PipelineException(FailureCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public FailureCategory getCategory() {
        return category;
    }
}
