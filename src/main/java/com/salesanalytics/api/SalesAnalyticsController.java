package com.salesanalytics.api;

import com.salesanalytics.domain.model.AnalysisJobStatus;
import com.salesanalytics.domain.model.AnalysisReport;
import com.salesanalytics.domain.model.DatasetOverview;
import com.salesanalytics.domain.model.ValidationResult;
import com.salesanalytics.domain.service.AnalysisJobProcessor;
import com.salesanalytics.domain.service.AnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for sales analysis.
 *
 * Every POST takes the raw CSV (header row first) as the request body.
 *
 * Endpoints:
 * - POST /api/v1/sales/validate - Check required columns
 * - POST /api/v1/sales/summary - Clean and summarize, with drop counts
 * - POST /api/v1/sales/analysis - Full analysis (trends, elasticity, performance)
 * - POST /api/v1/sales/jobs - Submit background analysis
 * - GET /api/v1/sales/jobs/{jobId} - Get job status and result
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sales")
@RequiredArgsConstructor
public class SalesAnalyticsController {

    private final AnalysisService analysisService;
    private final AnalysisJobProcessor jobProcessor;

    /**
     * Validate the column structure of the data.
     *
     * Response:
     * - ok: whether every required column is present
     * - errors: one message per missing column
     */
    @PostMapping(value = "/validate", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<ValidationResult> validate(@RequestBody String csv) {
        log.info("Validate sales data: {} chars", csv.length());

        return ResponseEntity.ok(analysisService.validate(csv));
    }

    @PostMapping(value = "/summary", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<DatasetOverview> summary(@RequestBody String csv) {
        log.info("Summarize sales data: {} chars", csv.length());

        return ResponseEntity.ok(analysisService.overview(csv));
    }

    /**
     * Full analysis.
     *
     * POST /api/v1/sales/analysis?topN=5
     *
     * Response:
     * - dataSummary: rows, date range, products, totals
     * - cleaning: rows removed per cleaning step
     * - metrics: trends, elasticity, performance
     * - metricsSummary: key insights
     * - cached: whether result was cached
     *
     * Metrics that cannot be computed are null, never 0.
     */
    @PostMapping(value = "/analysis", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<AnalysisReport> analyze(
            @RequestBody String csv,
            @RequestParam(required = false) Integer topN) {

        log.info("Analyze sales data: {} chars, topN={}", csv.length(), topN);

        return ResponseEntity.ok(analysisService.analyze(csv, topN));
    }

    /**
     * Submit a background analysis.
     *
     * Response:
     * {
     *   "jobId": "uuid"
     * }
     */
    @PostMapping(value = "/jobs", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<Map<String, UUID>> submitJob(
            @RequestBody String csv,
            @RequestParam(required = false) Integer topN) {

        log.info("Submit analysis job: {} chars, topN={}", csv.length(), topN);

        UUID jobId = jobProcessor.submitJob(csv, topN);

        return ResponseEntity.accepted().body(Map.of("jobId", jobId));
    }

    /**
     * Get job status and result.
     *
     * Response:
     * {
     *   "jobId": "uuid",
     *   "status": "PENDING|RUNNING|COMPLETED|FAILED",
     *   "rawRowCount": 1200,
     *   "cleanedRowCount": 1187,
     *   "rowsDropped": 13,
     *   "result": { ...analysis report... },
     *   "failureType": "DatasetValidationException",
     *   "errorMessage": "...",
     *   "executionTimeMs": 1234
     * }
     */
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AnalysisJobStatus> getJobStatus(@PathVariable UUID jobId) {
        log.info("Get job status: jobId={}", jobId);

        return ResponseEntity.ok(jobProcessor.getJobStatus(jobId));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
