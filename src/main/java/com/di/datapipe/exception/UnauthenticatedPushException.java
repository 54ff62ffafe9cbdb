package com.di.datapipe.exception;

/**
 * Push delivery without a verifiable identity token.
 */
public class UnauthenticatedPushException extends PipelineException {

    public UnauthenticatedPushException(String message) {
        super(FailureCategory.PERMISSION_DENIED, message);
    }

    public UnauthenticatedPushException(String message, Throwable cause) {
        super(FailureCategory.PERMISSION_DENIED, message, cause);
    }
}
