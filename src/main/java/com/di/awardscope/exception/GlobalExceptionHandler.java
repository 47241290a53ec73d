package com.di.awardscope.exception;

import com.di.awardscope.aspect.ErrorCategory;
import com.di.awardscope.export.ExportCancelledException;
import com.di.awardscope.filter.FilterValidationException;
import com.di.awardscope.query.QueryTimeoutException;
import com.di.awardscope.snapshot.InternalInconsistencyException;
import com.di.awardscope.snapshot.SnapshotLoadException;
import com.di.awardscope.snapshot.SnapshotUnavailableException;
import jakarta.validation.ConstraintViolationException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps exceptions escaping the controllers to a structured {@link ErrorResponse}.
 *
 * <p>Each handler categorizes with {@link ErrorCategory}, logs once and returns the HTTP status
 * for its exception type. Degraded query plans are not errors and never reach this class.
 *
 * <p><strong>Adding New Exception Handlers:</strong>
 * <pre>{@code
 * @ExceptionHandler(YourException.class)
 * public ResponseEntity<ErrorResponse> handleYourException(YourException e) {
 *     ErrorCategory category = ErrorCategory.categorize(e);
 *     logError("YOUR_EXCEPTION", category, e);
 *     return respond(category, e, HttpStatus.BAD_REQUEST);
 * }
 * }</pre>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /** Client closed request; no {@link HttpStatus} constant exists for it. */
    static final int CLIENT_CLOSED_REQUEST = 499;

    /**
     * Handles rejected filters, sort keys, windows and formats.
     */
    @ExceptionHandler(FilterValidationException.class)
    public ResponseEntity<ErrorResponse> handleFilterValidation(FilterValidationException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[VALIDATION] {} (rejected value: {})", e.getMessage(), e.getRejectedValue());
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        response.addDetail("field", e.getField());
        response.addDetail("rejectedValue", e.getRejectedValue() != null ? String.valueOf(e.getRejectedValue()) : null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Handles malformed request bodies and missing or blank request parameters.
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            ConstraintViolationException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[VALIDATION] Unreadable request: {}", e.getMessage());
        return respond(category, e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles other validation errors (IllegalArgumentException, IllegalStateException).
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e);
        return respond(category, e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles queries that exceeded their wall-clock budget.
     */
    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleQueryTimeout(QueryTimeoutException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[QUERY] Timeout: {}", e.getMessage());
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.REQUEST_TIMEOUT);
        response.addDetail("operation", e.getOperation());
        response.addDetail("timeoutMs", e.getTimeoutMs());
        return ResponseEntity.status(HttpStatus.REQUEST_TIMEOUT).body(response);
    }

    /**
     * Handles exports stopped by cancellation or client disconnect. Not an error.
     */
    @ExceptionHandler(ExportCancelledException.class)
    public ResponseEntity<ErrorResponse> handleExportCancelled(ExportCancelledException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.info("[EXPORT] Job {} stopped after {} rows: {}", e.getJobId(), e.getRowsEmitted(), e.getMessage());
        ErrorResponse response = new ErrorResponse();
        fill(response, category, e, CLIENT_CLOSED_REQUEST, "Client Closed Request");
        response.addDetail("jobId", e.getJobId());
        response.addDetail("rowsEmitted", e.getRowsEmitted());
        return ResponseEntity.status(CLIENT_CLOSED_REQUEST).body(response);
    }

    /**
     * Handles snapshot data that contradicts its manifest.
     */
    @ExceptionHandler(InternalInconsistencyException.class)
    public ResponseEntity<ErrorResponse> handleInconsistency(InternalInconsistencyException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("DATA_INTEGRITY_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR);
        response.addDetail("bucket", e.getBucketId());
        response.addDetail("dimension", e.getDimension());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    /**
     * Handles a missing or unloadable snapshot.
     */
    @ExceptionHandler({SnapshotUnavailableException.class, SnapshotLoadException.class})
    public ResponseEntity<ErrorResponse> handleSnapshotException(RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("SNAPSHOT_EXCEPTION", category, e);
        return respond(category, e, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Handles a saturated query-worker pool.
     */
    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejectedExecution(RejectedExecutionException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[QUERY] Worker pool saturated: {}", e.getMessage());
        return respond(category, e, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Handles all other unhandled exceptions (catch-all).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return respond(category, e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            log.error("[{}] {} [{}] root cause {}: {}", eventType, exception.getClass().getSimpleName(),
                    category.getName(), rootCause.getClass().getSimpleName(), rootCause.getMessage(), exception);
        } else {
            log.error("[{}] {} [{}]", eventType, exception.getClass().getSimpleName(), category.getName(), exception);
        }
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCategory category, Throwable exception, HttpStatus status) {
        return ResponseEntity.status(status).body(buildErrorResponse(category, exception, status));
    }

    ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        fill(response, category, exception, status.value(), status.getReasonPhrase());
        return response;
    }

    private void fill(ErrorResponse response, ErrorCategory category, Throwable exception, int status, String error) {
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status);
        response.setError(error);
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Gets the request path from MDC or returns default.
     */
    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
