package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One row of the per-product performance table.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProductPerformance {

    String productId;
    int observations;

    long totalUnits;
    double meanUnits;

    /** Sample standard deviation of units; undefined for a single observation. */
    @Builder.Default
    MetricValue unitsStdDev = MetricValue.undefined();

    double totalRevenue;
    double meanRevenue;
    double meanPrice;

    double marketShare;

    /** Coefficient of variation of units; lower is steadier. */
    @Builder.Default
    MetricValue stabilityCoefficient = MetricValue.undefined();

    int revenueRank;
}
