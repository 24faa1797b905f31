package com.salesanalytics.domain.exception;

/**
 * Base exception for fatal sales analysis failures.
 */
public class SalesAnalyticsException extends RuntimeException {

    public SalesAnalyticsException(String message) {
        super(message);
    }

    public SalesAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
