package com.salesanalytics.api;

import com.salesanalytics.domain.exception.AnalysisJobNotFoundException;
import com.salesanalytics.domain.exception.DatasetValidationException;
import com.salesanalytics.domain.exception.SalesAnalyticsException;
import com.salesanalytics.domain.exception.SalesDataReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DatasetValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationError(DatasetValidationException ex) {
        log.warn("Dataset validation failed: {}", ex.getErrors());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "Required columns are missing", ex.getErrors());
    }

    @ExceptionHandler(SalesDataReadException.class)
    public ResponseEntity<ErrorResponse> handleReadError(SalesDataReadException ex) {
        log.warn("Unreadable sales data: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Unreadable Data", ex.getMessage(), null);
    }

    @ExceptionHandler(AnalysisJobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(AnalysisJobNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), null);
    }

    @ExceptionHandler(SalesAnalyticsException.class)
    public ResponseEntity<ErrorResponse> handleAnalysisError(SalesAnalyticsException ex) {
        log.error("Sales analysis error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Analysis Error", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericError(Exception ex) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, List<String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
