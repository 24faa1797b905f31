package com.salesanalytics.domain.exception;

/**
 * Thrown when the sales source cannot be read or parsed as a table.
 */
public class SalesDataReadException extends SalesAnalyticsException {

    public SalesDataReadException(String message) {
        super(message);
    }

    public SalesDataReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
