package com.di.datapipe.exception;

import com.di.datapipe.util.MdcKeys;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps failures escaping controllers to HTTP status codes and an {@link ErrorResponse}.
 *
 * <p>For push endpoints the status is the acknowledgment: any non-2xx makes Pub/Sub redeliver.
 *
 * <table border="1">
 * <tr><th>Failure</th><th>Status</th></tr>
 * <tr><td>{@link UnauthenticatedPushException}</td><td>401</td></tr>
 * <tr><td>{@link PermissionDeniedException}</td><td>403</td></tr>
 * <tr><td>{@link InvalidMessageException}, unreadable body, bad argument</td><td>400</td></tr>
 * <tr><td>TRANSIENT, TIMEOUT</td><td>503</td></tr>
 * <tr><td>MALFORMED_INPUT, UNKNOWN</td><td>500</td></tr>
 * </table>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthenticatedPushException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedPushException e) {
        log.warn("[HTTP] unauthenticated: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, e.getCategory(), e);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handlePermissionDenied(PermissionDeniedException e) {
        log.error("[HTTP] permission denied: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, e.getCategory(), e);
    }

    @ExceptionHandler(InvalidMessageException.class)
    public ResponseEntity<ErrorResponse> handleInvalidMessage(InvalidMessageException e) {
        log.error("[HTTP] invalid message: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getCategory(), e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("[HTTP] bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, FailureCategory.INVALID_MESSAGE, e);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipelineException(PipelineException e) {
        FailureCategory category = e.getCategory();
        HttpStatus status = category == FailureCategory.TRANSIENT || category == FailureCategory.TIMEOUT
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
        log.warn("[HTTP] stage failure [{}]: {}", category.name(), e.getMessage());
        return respond(status, category, e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        FailureCategory category = FailureCategory.categorize(e);
        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                e.getClass().getSimpleName(), category.getName(), e);
        HttpStatus status = category == FailureCategory.TRANSIENT || category == FailureCategory.TIMEOUT
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
        return respond(status, category, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, FailureCategory category, Throwable e) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setRetryable(category.isRetryable());
        String path = MDC.get(MdcKeys.REQUEST_PATH);
        response.setPath(path != null ? path : "/unknown");
        response.addDetail("exceptionType", e.getClass().getName());
        Throwable root = rootCause(e);
        if (root != e) {
            response.addDetail("rootCauseType", root.getClass().getName());
            response.addDetail("rootCauseMessage", root.getMessage());
        }
        return ResponseEntity.status(status).body(response);
    }

    private static Throwable rootCause(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t;
    }
}
