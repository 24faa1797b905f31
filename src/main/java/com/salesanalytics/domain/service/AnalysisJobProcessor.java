package com.salesanalytics.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesanalytics.config.SalesAnalyticsProperties;
import com.salesanalytics.domain.exception.AnalysisJobNotFoundException;
import com.salesanalytics.domain.exception.DatasetValidationException;
import com.salesanalytics.domain.exception.SalesDataReadException;
import com.salesanalytics.domain.model.AnalysisJobStatus;
import com.salesanalytics.domain.model.AnalysisReport;
import com.salesanalytics.infrastructure.persistence.entity.AnalysisJobEntity;
import com.salesanalytics.infrastructure.persistence.entity.AnalysisJobState;
import com.salesanalytics.infrastructure.persistence.repository.AnalysisJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Background processor for large analyses.
 *
 * Processing Flow:
 * 1. Client submits CSV data, job created with PENDING status
 * 2. Client receives job ID immediately
 * 3. Poller picks up PENDING jobs every second, oldest first
 * 4. Job marked RUNNING, analysis executed
 * 5. COMPLETED: row counts and report JSON stored, upload released
 *    FAILED: failure type and message stored, upload kept
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisJobProcessor {

    private final AnalysisJobRepository jobRepository;
    private final AnalysisService analysisService;
    private final ObjectMapper objectMapper;
    private final SalesAnalyticsProperties properties;

    @Transactional
    public UUID submitJob(String csvContent, Integer topN) {
        if (csvContent == null || csvContent.isBlank()) {
            throw new SalesDataReadException("Sales data is empty");
        }
        int effectiveTopN = topN != null ? topN : properties.getDefaultTopN();
        if (effectiveTopN < 1) {
            throw new IllegalArgumentException("topN must be at least 1, was " + effectiveTopN);
        }

        AnalysisJobEntity job = jobRepository.save(AnalysisJobEntity.queued(csvContent, effectiveTopN));

        log.info("Analysis job submitted: {} ({} chars, topN: {})", job.getJobId(), job.getUploadChars(), effectiveTopN);
        return job.getJobId();
    }

    @Transactional(readOnly = true)
    public AnalysisJobStatus getJobStatus(UUID jobId) {
        AnalysisJobEntity job = jobRepository.findById(jobId)
                .orElseThrow(() -> new AnalysisJobNotFoundException(jobId));

        return AnalysisJobStatus.builder()
                .jobId(job.getJobId())
                .status(job.getState().name())
                .topN(job.getTopN())
                .rawRowCount(job.getRawRowCount())
                .cleanedRowCount(job.getCleanedRowCount())
                .rowsDropped(job.getRowsDropped())
                .productCount(job.getProductCount())
                .cached(job.getServedFromCache())
                .result(job.getReportJson())
                .failureType(job.getFailureType())
                .errorMessage(job.getFailureMessage())
                .submittedAt(job.getSubmittedAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .executionTimeMs(job.getExecutionTimeMs())
                .build();
    }

    @Scheduled(fixedDelay = 1000)
    public void processPendingJobs() {
        List<AnalysisJobEntity> pendingJobs = jobRepository
                .findTop10ByStateOrderBySubmittedAtAsc(AnalysisJobState.PENDING);

        if (pendingJobs.isEmpty()) {
            return;
        }

        log.debug("Processing {} pending analysis jobs", pendingJobs.size());

        for (AnalysisJobEntity job : pendingJobs) {
            processJob(job);
        }
    }

    void processJob(AnalysisJobEntity job) {
        log.info("Processing analysis job: {} ({} chars, topN: {})", job.getJobId(), job.getUploadChars(), job.getTopN());

        job.start();
        jobRepository.save(job);

        try {
            AnalysisReport report = analysisService.analyze(job.getCsvContent(), job.getTopN());
            job.succeed(report, objectMapper.writeValueAsString(report));

            log.info("Analysis job completed: {} ({} of {} rows kept, {} ms)",
                    job.getJobId(), job.getCleanedRowCount(), job.getRawRowCount(), job.getExecutionTimeMs());

        } catch (SalesDataReadException | DatasetValidationException e) {
            log.warn("Analysis job {} rejected its data: {}", job.getJobId(), e.getMessage());
            job.fail(e);

        } catch (Exception e) {
            log.error("Error processing analysis job {}: {}", job.getJobId(), e.getMessage(), e);
            job.fail(e);
        }

        jobRepository.save(job);
    }
}
