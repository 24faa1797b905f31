package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Key insights handed to reporting: yearly growth, the best-selling product
 * and the products whose demand reacts strongly to price.
 */
@Value
@Builder
@Jacksonized
public class MetricsSummary {

    @Builder.Default
    MetricValue avgYearlyUnitsGrowth = MetricValue.undefined();

    String bestSellingProduct;

    List<String> elasticProducts;
}
