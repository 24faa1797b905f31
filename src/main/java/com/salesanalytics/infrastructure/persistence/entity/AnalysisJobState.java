package com.salesanalytics.infrastructure.persistence.entity;

/**
 * Lifecycle of a background analysis: PENDING → RUNNING → COMPLETED or FAILED.
 */
public enum AnalysisJobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
