package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.CleanedDataset;
import com.salesanalytics.domain.model.ElasticityClassification;
import com.salesanalytics.domain.model.ElasticityMetric;
import com.salesanalytics.domain.model.MetricsResult;
import com.salesanalytics.domain.model.MetricsSummary;
import com.salesanalytics.domain.model.PeriodAggregate;
import com.salesanalytics.domain.model.PerformanceLeaders;
import com.salesanalytics.domain.model.ProductPerformance;
import com.salesanalytics.domain.model.TrendMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.salesanalytics.domain.service.SalesTestData.dataset;
import static com.salesanalytics.domain.service.SalesTestData.record;
import static com.salesanalytics.domain.service.SalesTestData.twoProductScenario;
import static org.junit.jupiter.api.Assertions.*;

class MetricsEngineTest {

    @Test
    void testCalculateAll_TwoProductScenario() {
        // Given
        MetricsEngine engine = new MetricsEngine(twoProductScenario());

        // When
        MetricsResult result = engine.calculateAll();

        // Then: monthly units are flat, revenue grows
        List<PeriodAggregate> monthly = result.getTrends().getMonthly();
        assertEquals(2, monthly.size());
        assertEquals(150, monthly.get(0).getUnitsSold());
        assertFalse(monthly.get(0).getUnitsGrowth().isDefined());
        assertEquals(0.0, monthly.get(1).getUnitsGrowth().value(), 1e-9);
        assertEquals(10.5, monthly.get(1).getRevenueGrowth().value(), 1e-9);

        // Then: unit elasticity is inelastic, B reacts less than proportionally
        Map<String, ElasticityMetric> elasticity = result.getElasticity();
        assertEquals(List.of("A", "B"), List.copyOf(elasticity.keySet()));
        assertEquals(1.0, elasticity.get("A").getCoefficient(), 1e-9);
        assertEquals(ElasticityClassification.INELASTIC, elasticity.get("A").getClassification());
        assertEquals(-0.8, elasticity.get("B").getCoefficient(), 1e-9);
        assertEquals(ElasticityClassification.INELASTIC, elasticity.get("B").getClassification());

        // Then: A leads on revenue, units and stability
        List<ProductPerformance> products = result.getPerformance().getProducts();
        assertEquals("A", products.get(0).getProductId());
        assertEquals(2210.0, products.get(0).getTotalRevenue(), 1e-9);
        assertEquals(70.0, products.get(0).getMarketShare(), 1e-9);
        assertEquals(30.0, products.get(1).getMarketShare(), 1e-9);

        PerformanceLeaders leaders = result.getPerformance().getLeaders();
        assertEquals("A", leaders.getBestSelling());
        assertEquals("A", leaders.getHighestRevenue());
        assertEquals("A", leaders.getMostStable());
    }

    @Test
    void testCalculateAll_SingleYearHasNoYearlyGrowth() {
        TrendMetrics trends = new MetricsEngine(twoProductScenario()).calculateTrends();

        assertEquals(1, trends.getYearly().size());
        assertFalse(trends.getYearly().get(0).getUnitsGrowth().isDefined());
        assertFalse(trends.getGrowth().getAvgYearlyUnitsGrowth().isDefined());
        assertFalse(trends.getGrowth().getAvgYearlyRevenueGrowth().isDefined());
        assertTrue(trends.getGrowth().getAvgMonthlyUnitsGrowth().isDefined());
    }

    @Test
    void testCalculateAll_EmptyDataset() {
        MetricsResult result = new MetricsEngine(dataset()).calculateAll();

        assertTrue(result.getTrends().getMonthly().isEmpty());
        assertTrue(result.getTrends().getYearly().isEmpty());
        assertFalse(result.getTrends().getGrowth().getAvgMonthlyUnitsGrowth().isDefined());
        assertTrue(result.getElasticity().isEmpty());
        assertTrue(result.getPerformance().getProducts().isEmpty());
        assertTrue(result.getPerformance().getTopPerformers().isEmpty());
        assertNull(result.getPerformance().getLeaders().getBestSelling());
        assertNull(result.getPerformance().getLeaders().getHighestRevenue());
        assertNull(result.getPerformance().getLeaders().getMostStable());
    }

    @Test
    void testCalculateAll_IsRepeatable() {
        CleanedDataset data = twoProductScenario();
        MetricsEngine engine = new MetricsEngine(data);

        assertEquals(engine.calculateAll(3), engine.calculateAll(3));
        assertEquals(engine.calculateAll(3), new MetricsEngine(data).calculateAll(3));
    }

    @Test
    void testCalculateAll_RejectsNonPositiveTopN() {
        MetricsEngine engine = new MetricsEngine(twoProductScenario());

        assertThrows(IllegalArgumentException.class, () -> engine.calculateAll(0));
    }

    @Test
    void testSummarize() {
        // Given: C halves its units on a 10% price rise
        CleanedDataset data = dataset(
                record("2021-06-01", "C", 100, 10),
                record("2021-06-01", "D", 10, 50),
                record("2022-06-01", "C", 80, 11),
                record("2022-06-01", "D", 12, 50));

        // When
        MetricsSummary summary = MetricsEngine.summarize(new MetricsEngine(data).calculateAll());

        // Then
        assertEquals(List.of("C"), summary.getElasticProducts());
        assertEquals("C", summary.getBestSellingProduct());
        assertEquals((92.0 - 110.0) / 110.0 * 100, summary.getAvgYearlyUnitsGrowth().value(), 1e-9);
    }
}
