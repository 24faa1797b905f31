package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class TrendMetrics {

    @Singular("monthlyPeriod")
    List<PeriodAggregate> monthly;

    @Singular("yearlyPeriod")
    List<PeriodAggregate> yearly;

    GrowthSummary growth;
}
