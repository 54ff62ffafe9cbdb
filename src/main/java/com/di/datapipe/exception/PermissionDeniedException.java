package com.di.datapipe.exception;

/**
 * Thrown when an identity attempts an operation outside its grants, or when a push
 * delivery carries the wrong invoker principal. Never retried.
 *
 * <p>Caught by {@link GlobalExceptionHandler} and returned as 403 Forbidden.
 */
public class PermissionDeniedException extends PipelineException {

    public PermissionDeniedException(String message) {
        super(FailureCategory.PERMISSION_DENIED, message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(FailureCategory.PERMISSION_DENIED, message, cause);
    }
}
