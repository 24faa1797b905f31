package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Named leaders of the performance table. Every field is null for an empty dataset;
 * {@code mostStable} is also null when no product has a defined stability coefficient.
 */
@Value
@Builder
@Jacksonized
public class PerformanceLeaders {

    String bestSelling;
    String highestRevenue;
    String mostStable;

    public static PerformanceLeaders none() {
        return PerformanceLeaders.builder().build();
    }
}
