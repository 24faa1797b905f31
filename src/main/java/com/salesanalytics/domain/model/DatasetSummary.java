package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Headline figures of a cleaned dataset. Date range is null when the dataset is empty.
 */
@Value
@Builder
@Jacksonized
public class DatasetSummary {

    int totalRows;
    LocalDate startDate;
    LocalDate endDate;
    int productCount;
    long totalUnitsSold;
    double totalRevenue;
    double meanPrice;

    public static DatasetSummary empty() {
        return DatasetSummary.builder().build();
    }
}
