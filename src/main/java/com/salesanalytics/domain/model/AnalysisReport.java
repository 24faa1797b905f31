package com.salesanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response model for a full analysis run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisReport {

    private DatasetSummary dataSummary;
    private CleaningReport cleaning;
    private MetricsResult metrics;
    private MetricsSummary metricsSummary;
    private boolean cached;
    private long analysisTimeMs;
}
