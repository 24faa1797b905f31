package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Audit trail of a cleaning run: how many rows each step removed and why.
 */
@Value
@Builder
@Jacksonized
public class CleaningReport {

    int rawRowCount;
    int cleanedRowCount;

    @Singular
    List<CleaningStepResult> steps;

    /**
     * Rows dropped by the named step, 0 when the step did not run.
     */
    public int droppedFor(String step) {
        return steps.stream()
                .filter(result -> result.getStep().equals(step))
                .mapToInt(CleaningStepResult::getRowsDropped)
                .sum();
    }

    public int totalDropped() {
        return rawRowCount - cleanedRowCount;
    }
}
