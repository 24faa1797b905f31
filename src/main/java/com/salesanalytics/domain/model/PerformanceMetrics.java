package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class PerformanceMetrics {

    /** All products, descending by total revenue. */
    @Singular("product")
    List<ProductPerformance> products;

    @Singular("topPerformer")
    List<ProductPerformance> topPerformers;

    PerformanceLeaders leaders;
}
