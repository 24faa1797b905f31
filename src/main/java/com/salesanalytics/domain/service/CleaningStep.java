package com.salesanalytics.domain.service;

import java.util.List;

/**
 * One ordered transform of the cleaning pipeline. A step may drop rows or
 * reorder them, never alter the surviving rows' source values.
 */
interface CleaningStep {

    String name();

    /** Why rows are dropped by this step. */
    String reason();

    List<StagedRow> apply(List<StagedRow> rows);
}
