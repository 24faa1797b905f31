package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Mean period-over-period change (percent) at monthly and yearly granularity.
 */
@Value
@Builder
@Jacksonized
public class GrowthSummary {

    @Builder.Default
    MetricValue avgMonthlyUnitsGrowth = MetricValue.undefined();

    @Builder.Default
    MetricValue avgMonthlyRevenueGrowth = MetricValue.undefined();

    @Builder.Default
    MetricValue avgYearlyUnitsGrowth = MetricValue.undefined();

    @Builder.Default
    MetricValue avgYearlyRevenueGrowth = MetricValue.undefined();
}
