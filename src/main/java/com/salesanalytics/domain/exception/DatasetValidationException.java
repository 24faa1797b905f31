package com.salesanalytics.domain.exception;

import java.util.List;

/**
 * Thrown when required columns are missing; no metric is computed for such a source.
 */
public class DatasetValidationException extends SalesAnalyticsException {

    private final List<String> errors;

    public DatasetValidationException(List<String> errors) {
        super("Data validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
