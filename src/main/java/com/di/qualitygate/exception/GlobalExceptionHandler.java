package com.di.qualitygate.exception;

import com.di.qualitygate.batch.BatchAlreadyRunningException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST controllers to an {@link ErrorResponse}
 * carrying the {@link ErrorCategory}.
 *
 * <p>A failed batch is not an exception: the controller returns its metrics
 * with status 500 itself.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BatchAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleBatchAlreadyRunning(BatchAlreadyRunningException e, HttpServletRequest request) {
        log.warn("Batch request refused: {}", e.getMessage());
        ErrorResponse body = buildErrorResponse(ErrorCategory.VALIDATION_ERROR, e, HttpStatus.CONFLICT, request);
        body.addDetail("runningRunId", e.getRunningRunId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(IllegalArgumentException e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(category, e);
        return ResponseEntity.badRequest().body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST, request));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR, request));
    }

    /** Catch-all. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR, request));
    }

    private void logError(ErrorCategory category, Throwable exception) {
        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                exception.getClass().getSimpleName(), category.getName(), exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status,
                                             HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(request.getRequestURI());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
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
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
