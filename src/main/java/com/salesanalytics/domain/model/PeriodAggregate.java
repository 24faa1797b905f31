package com.salesanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Sales totals for one calendar period (a month, or a whole year when {@code month} is null)
 * together with the change against the previous period.
 */
@Value
@Builder
@Jacksonized
public class PeriodAggregate {

    int year;
    Integer month;

    long unitsSold;
    double revenue;
    double meanPrice;

    @Builder.Default
    MetricValue unitsGrowth = MetricValue.undefined();

    @Builder.Default
    MetricValue revenueGrowth = MetricValue.undefined();

    @JsonIgnore
    public String getLabel() {
        return month == null ? String.valueOf(year) : String.format("%d-%02d", year, month);
    }
}
