package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.GrowthSummary;
import com.salesanalytics.domain.model.MetricValue;
import com.salesanalytics.domain.model.PeriodAggregate;
import com.salesanalytics.domain.model.SalesRecord;
import com.salesanalytics.domain.model.TrendMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Monthly and yearly sales totals with period-over-period growth.
 *
 * A granularity with fewer than two periods has no growth at all: every
 * change and the mean stay undefined rather than zero.
 */
@Slf4j
class TrendCalculator {

    TrendMetrics calculate(List<SalesRecord> records) {
        log.info("Calculating sales trends");

        List<PeriodAggregate> monthly = aggregate(records, record -> record.getYear() * 100 + record.getMonth(), true);
        List<PeriodAggregate> yearly = aggregate(records, SalesRecord::getYear, false);

        GrowthSummary growth = GrowthSummary.builder()
                .avgMonthlyUnitsGrowth(mean(monthly, PeriodAggregate::getUnitsGrowth))
                .avgMonthlyRevenueGrowth(mean(monthly, PeriodAggregate::getRevenueGrowth))
                .avgYearlyUnitsGrowth(mean(yearly, PeriodAggregate::getUnitsGrowth))
                .avgYearlyRevenueGrowth(mean(yearly, PeriodAggregate::getRevenueGrowth))
                .build();

        log.info("Calculated trends over {} months and {} years: avg YoY units growth = {}",
                monthly.size(), yearly.size(), growth.getAvgYearlyUnitsGrowth());

        return TrendMetrics.builder()
                .monthly(monthly)
                .yearly(yearly)
                .growth(growth)
                .build();
    }

    /**
     * Groups by a chronologically sortable period key (yyyymm or yyyy).
     */
    private List<PeriodAggregate> aggregate(List<SalesRecord> records,
                                            Function<SalesRecord, Integer> periodKey,
                                            boolean withMonth) {
        Map<Integer, PeriodTotals> totals = new TreeMap<>();
        for (SalesRecord record : records) {
            totals.computeIfAbsent(periodKey.apply(record), key -> new PeriodTotals(record.getYear(),
                    withMonth ? record.getMonth() : null)).add(record);
        }

        List<PeriodTotals> periods = new ArrayList<>(totals.values());
        double[] units = new double[periods.size()];
        double[] revenue = new double[periods.size()];
        for (int i = 0; i < periods.size(); i++) {
            units[i] = periods.get(i).units;
            revenue[i] = periods.get(i).revenue;
        }
        List<MetricValue> unitsGrowth = PercentChange.series(units);
        List<MetricValue> revenueGrowth = PercentChange.series(revenue);

        List<PeriodAggregate> aggregates = new ArrayList<>(periods.size());
        for (int i = 0; i < periods.size(); i++) {
            PeriodTotals period = periods.get(i);
            aggregates.add(PeriodAggregate.builder()
                    .year(period.year)
                    .month(period.month)
                    .unitsSold(period.units)
                    .revenue(period.revenue)
                    .meanPrice(period.priceSum / period.count)
                    .unitsGrowth(unitsGrowth.get(i))
                    .revenueGrowth(revenueGrowth.get(i))
                    .build());
        }
        return aggregates;
    }

    private static MetricValue mean(List<PeriodAggregate> periods, Function<PeriodAggregate, MetricValue> growth) {
        List<MetricValue> values = new ArrayList<>(periods.size());
        for (PeriodAggregate period : periods) {
            values.add(growth.apply(period));
        }
        return PercentChange.meanOfDefined(values);
    }

    private static final class PeriodTotals {

        private final int year;
        private final Integer month;
        private long units;
        private double revenue;
        private double priceSum;
        private int count;

        PeriodTotals(int year, Integer month) {
            this.year = year;
            this.month = month;
        }

        void add(SalesRecord record) {
            units += record.getUnitsSold();
            revenue += record.getRevenue();
            priceSum += record.getAvgPrice();
            count++;
        }
    }
}
