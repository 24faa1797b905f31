package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.CleanedDataset;
import com.salesanalytics.domain.model.ElasticityClassification;
import com.salesanalytics.domain.model.ElasticityMetric;
import com.salesanalytics.domain.model.MetricsResult;
import com.salesanalytics.domain.model.MetricsSummary;
import com.salesanalytics.domain.model.PerformanceMetrics;
import com.salesanalytics.domain.model.TrendMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Derives trend, elasticity and performance metrics from one cleaned dataset.
 *
 * An engine holds a single dataset snapshot and keeps no other state, so
 * every calculation is a pure function of that snapshot. Build one engine
 * per run; instances are not shared between runs.
 */
@Slf4j
public class MetricsEngine {

    public static final int DEFAULT_TOP_N = 5;

    private final CleanedDataset dataset;
    private final TrendCalculator trendCalculator = new TrendCalculator();
    private final ElasticityCalculator elasticityCalculator = new ElasticityCalculator();
    private final PerformanceRanker performanceRanker = new PerformanceRanker();

    public MetricsEngine(CleanedDataset dataset) {
        this.dataset = dataset;
    }

    public TrendMetrics calculateTrends() {
        return trendCalculator.calculate(dataset.getRecords());
    }

    public Map<String, ElasticityMetric> calculateElasticity() {
        return elasticityCalculator.calculate(dataset.getRecords());
    }

    public PerformanceMetrics calculatePerformance(int topN) {
        return performanceRanker.calculate(dataset.getRecords(), topN);
    }

    public MetricsResult calculateAll() {
        return calculateAll(DEFAULT_TOP_N);
    }

    public MetricsResult calculateAll(int topN) {
        log.info("Starting metrics calculation over {} records", dataset.size());

        MetricsResult result = MetricsResult.builder()
                .trends(calculateTrends())
                .elasticity(calculateElasticity())
                .performance(calculatePerformance(topN))
                .build();

        log.info("All metrics calculated");
        return result;
    }

    /**
     * Key insights for reporting.
     */
    public static MetricsSummary summarize(MetricsResult metrics) {
        List<String> elastic = metrics.getElasticity().values().stream()
                .filter(metric -> metric.getClassification() == ElasticityClassification.ELASTIC)
                .map(ElasticityMetric::getProductId)
                .collect(Collectors.toList());

        return MetricsSummary.builder()
                .avgYearlyUnitsGrowth(metrics.getTrends().getGrowth().getAvgYearlyUnitsGrowth())
                .bestSellingProduct(metrics.getPerformance().getLeaders().getBestSelling())
                .elasticProducts(elastic)
                .build();
    }
}
