package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.PerformanceMetrics;
import com.salesanalytics.domain.model.ProductPerformance;
import com.salesanalytics.domain.model.SalesRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.salesanalytics.domain.service.SalesTestData.dataset;
import static com.salesanalytics.domain.service.SalesTestData.record;
import static org.junit.jupiter.api.Assertions.*;

class PerformanceRankerTest {

    private final PerformanceRanker ranker = new PerformanceRanker();

    private List<SalesRecord> tiedRevenue() {
        return dataset(
                record("2022-01-01", "X", 10, 10),
                record("2022-01-01", "Y", 20, 5),
                record("2022-01-01", "Z", 5, 10),
                record("2022-01-01", "W", 30, 10)).getRecords();
    }

    @Test
    void testCalculate_CompetitionRankingOnTies() {
        // When
        PerformanceMetrics result = ranker.calculate(tiedRevenue(), 5);

        // Then: W=300, X=Y=100, Z=50
        List<String> order = result.getProducts().stream()
                .map(ProductPerformance::getProductId)
                .collect(Collectors.toList());
        List<Integer> ranks = result.getProducts().stream()
                .map(ProductPerformance::getRevenueRank)
                .collect(Collectors.toList());

        assertEquals(List.of("W", "X", "Y", "Z"), order);
        assertEquals(List.of(1, 2, 2, 4), ranks);
    }

    @Test
    void testCalculate_MarketShareSumsToHundred() {
        PerformanceMetrics result = ranker.calculate(dataset(
                record("2022-01-01", "A", 7, 1),
                record("2022-01-01", "B", 13, 1),
                record("2022-02-01", "A", 3, 1),
                record("2022-02-01", "C", 11, 1),
                record("2022-03-01", "D", 1, 1)).getRecords(), 5);

        double total = result.getProducts().stream().mapToDouble(ProductPerformance::getMarketShare).sum();

        assertEquals(100.0, total, 1e-6);
    }

    @Test
    void testCalculate_SampleStandardDeviation() {
        PerformanceMetrics result = ranker.calculate(dataset(
                record("2022-01-01", "A", 2, 1),
                record("2022-02-01", "A", 4, 1),
                record("2022-03-01", "A", 6, 1)).getRecords(), 1);

        ProductPerformance a = result.getProducts().get(0);
        assertEquals(3, a.getObservations());
        assertEquals(4.0, a.getMeanUnits(), 1e-9);
        assertEquals(2.0, a.getUnitsStdDev().value(), 1e-9);
        assertEquals(0.5, a.getStabilityCoefficient().value(), 1e-9);
    }

    @Test
    void testCalculate_MostStableUndefinedForSingleObservations() {
        PerformanceMetrics result = ranker.calculate(tiedRevenue(), 5);

        assertTrue(result.getProducts().stream().noneMatch(p -> p.getUnitsStdDev().isDefined()));
        assertNull(result.getLeaders().getMostStable());
        assertEquals("W", result.getLeaders().getBestSelling());
        assertEquals("W", result.getLeaders().getHighestRevenue());
    }

    @Test
    void testCalculate_BestSellingFollowsUnitsNotRevenue() {
        PerformanceMetrics result = ranker.calculate(dataset(
                record("2022-01-01", "Premium", 5, 1000),
                record("2022-01-01", "Budget", 400, 10)).getRecords(), 5);

        assertEquals("Budget", result.getLeaders().getBestSelling());
        assertEquals("Premium", result.getLeaders().getHighestRevenue());
    }

    @Test
    void testCalculate_TopPerformersSlice() {
        assertEquals(2, ranker.calculate(tiedRevenue(), 2).getTopPerformers().size());
        assertEquals(4, ranker.calculate(tiedRevenue(), 10).getTopPerformers().size());
        assertEquals("W", ranker.calculate(tiedRevenue(), 1).getTopPerformers().get(0).getProductId());
    }

    @Test
    void testCalculate_RejectsNonPositiveTopN() {
        assertThrows(IllegalArgumentException.class, () -> ranker.calculate(tiedRevenue(), 0));
    }
}
