package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.PeriodAggregate;
import com.salesanalytics.domain.model.TrendMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.salesanalytics.domain.service.SalesTestData.dataset;
import static com.salesanalytics.domain.service.SalesTestData.record;
import static org.junit.jupiter.api.Assertions.*;

class TrendCalculatorTest {

    private final TrendCalculator calculator = new TrendCalculator();

    @Test
    void testCalculate_MonthlyGrowthSeries() {
        // Given: 100, 120, 90 units over three months
        TrendMetrics trends = calculator.calculate(dataset(
                record("2022-01-10", "A", 60, 2),
                record("2022-01-20", "B", 40, 3),
                record("2022-02-05", "A", 120, 2),
                record("2022-03-05", "A", 90, 2)).getRecords());

        List<PeriodAggregate> monthly = trends.getMonthly();

        // Then
        assertEquals(List.of("2022-01", "2022-02", "2022-03"),
                List.of(monthly.get(0).getLabel(), monthly.get(1).getLabel(), monthly.get(2).getLabel()));
        assertFalse(monthly.get(0).getUnitsGrowth().isDefined());
        assertEquals(20.0, monthly.get(1).getUnitsGrowth().value(), 1e-9);
        assertEquals(-25.0, monthly.get(2).getUnitsGrowth().value(), 1e-9);
        assertEquals(-2.5, trends.getGrowth().getAvgMonthlyUnitsGrowth().value(), 1e-9);
        assertEquals(2.5, monthly.get(0).getMeanPrice(), 1e-9);
    }

    @Test
    void testCalculate_SingleMonthGrowthIsUndefinedNotZero() {
        TrendMetrics trends = calculator.calculate(dataset(
                record("2022-01-01", "A", 10, 1),
                record("2022-01-15", "A", 10, 1)).getRecords());

        assertEquals(1, trends.getMonthly().size());
        assertFalse(trends.getMonthly().get(0).getUnitsGrowth().isDefined());
        assertFalse(trends.getGrowth().getAvgMonthlyUnitsGrowth().isDefined());
        assertFalse(trends.getGrowth().getAvgMonthlyRevenueGrowth().isDefined());
    }

    @Test
    void testCalculate_YearlyPeriodsAreChronological() {
        TrendMetrics trends = calculator.calculate(dataset(
                record("2021-12-31", "A", 100, 1),
                record("2022-01-01", "A", 150, 2),
                record("2023-06-01", "A", 75, 2)).getRecords());

        List<PeriodAggregate> yearly = trends.getYearly();
        assertEquals(3, yearly.size());
        assertEquals(2021, yearly.get(0).getYear());
        assertNull(yearly.get(0).getMonth());
        assertEquals("2023", yearly.get(2).getLabel());
        assertEquals(50.0, yearly.get(1).getUnitsGrowth().value(), 1e-9);
        assertEquals(200.0, yearly.get(1).getRevenueGrowth().value(), 1e-9);
        assertEquals(-50.0, yearly.get(2).getUnitsGrowth().value(), 1e-9);
        assertEquals(0.0, trends.getGrowth().getAvgYearlyUnitsGrowth().value(), 1e-9);
    }
}
