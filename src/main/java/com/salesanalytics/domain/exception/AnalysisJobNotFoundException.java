package com.salesanalytics.domain.exception;

import java.util.UUID;

public class AnalysisJobNotFoundException extends SalesAnalyticsException {

    public AnalysisJobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
    }
}
