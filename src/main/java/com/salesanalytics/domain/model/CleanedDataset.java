package com.salesanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Validated, deduplicated sales records sorted ascending by date.
 *
 * Immutable; the only input of metric computation.
 */
@Value
public class CleanedDataset {

    List<SalesRecord> records;
    CleaningReport report;

    @Builder
    @Jacksonized
    public CleanedDataset(List<SalesRecord> records, CleaningReport report) {
        this.records = List.copyOf(records);
        this.report = report;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
