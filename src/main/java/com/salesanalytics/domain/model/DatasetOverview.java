package com.salesanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response model for a cleaning-only run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetOverview {

    private DatasetSummary dataSummary;
    private CleaningReport cleaning;
}
