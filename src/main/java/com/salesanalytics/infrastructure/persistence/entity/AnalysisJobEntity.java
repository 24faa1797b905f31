package com.salesanalytics.infrastructure.persistence.entity;

import com.salesanalytics.domain.model.AnalysisReport;
import com.salesanalytics.domain.model.CleaningReport;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A sales analysis queued for background processing.
 *
 * The uploaded CSV is held only until the analysis succeeds; from then on the
 * row carries the outcome: row counts before and after cleaning, the product
 * count and the report JSON. A failed job keeps its upload together with the
 * failure type and message.
 */
@Entity
@Table(name = "analysis_jobs", indexes = {
    @Index(name = "idx_analysis_jobs_state_submitted", columnList = "state, submittedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AnalysisJobEntity {

    static final int FAILURE_MESSAGE_LENGTH = 500;

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AnalysisJobState state;

    @Column(nullable = false)
    private int topN;

    @Column(columnDefinition = "TEXT")
    private String csvContent;

    @Column(nullable = false)
    private int uploadChars;

    private Integer rawRowCount;
    private Integer cleanedRowCount;
    private Integer productCount;
    private Boolean servedFromCache;
    private Long analysisTimeMs;

    @Column(columnDefinition = "TEXT")
    private String reportJson;

    @Column(length = 100)
    private String failureType;

    @Column(length = FAILURE_MESSAGE_LENGTH)
    private String failureMessage;

    @Column(nullable = false)
    private Instant submittedAt;

    private Instant startedAt;
    private Instant finishedAt;

    public static AnalysisJobEntity queued(String csvContent, int topN) {
        AnalysisJobEntity job = new AnalysisJobEntity();
        job.state = AnalysisJobState.PENDING;
        job.topN = topN;
        job.csvContent = csvContent;
        job.uploadChars = csvContent.length();
        job.submittedAt = Instant.now();
        return job;
    }

    @PrePersist
    protected void assignId() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
    }

    public void start() {
        if (state != AnalysisJobState.PENDING) {
            throw new IllegalStateException("Job " + jobId + " cannot start from state " + state);
        }
        state = AnalysisJobState.RUNNING;
        startedAt = Instant.now();
    }

    public void succeed(AnalysisReport report, String reportJson) {
        CleaningReport cleaning = report.getCleaning();
        rawRowCount = cleaning.getRawRowCount();
        cleanedRowCount = cleaning.getCleanedRowCount();
        productCount = report.getDataSummary().getProductCount();
        servedFromCache = report.isCached();
        analysisTimeMs = report.getAnalysisTimeMs();
        this.reportJson = reportJson;
        csvContent = null;
        finish(AnalysisJobState.COMPLETED);
    }

    public void fail(Exception cause) {
        failureType = cause.getClass().getSimpleName();
        String message = cause.getMessage();
        failureMessage = message != null && message.length() > FAILURE_MESSAGE_LENGTH
                ? message.substring(0, FAILURE_MESSAGE_LENGTH)
                : message;
        finish(AnalysisJobState.FAILED);
    }

    /**
     * Rows removed by cleaning; null until the job has succeeded.
     */
    public Integer getRowsDropped() {
        return rawRowCount == null ? null : rawRowCount - cleanedRowCount;
    }

    /**
     * Wall time from start to finish; null while the job is pending or running.
     */
    public Long getExecutionTimeMs() {
        if (startedAt == null || finishedAt == null) {
            return null;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    private void finish(AnalysisJobState outcome) {
        state = outcome;
        finishedAt = Instant.now();
    }
}
