package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.MetricValue;
import com.salesanalytics.domain.model.PerformanceLeaders;
import com.salesanalytics.domain.model.PerformanceMetrics;
import com.salesanalytics.domain.model.ProductPerformance;
import com.salesanalytics.domain.model.SalesRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Per-product performance table, revenue ranking and named leaders.
 *
 * Standard deviation of units is the sample deviation (Bessel's correction)
 * and is undefined for a product with a single observation, which also leaves
 * its stability coefficient undefined.
 *
 * Ranking is standard competition ranking on total revenue: equal revenues
 * share a rank and the next rank skips (1, 2, 2, 4).
 */
@Slf4j
class PerformanceRanker {

    PerformanceMetrics calculate(List<SalesRecord> records, int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be at least 1, was " + topN);
        }

        log.info("Calculating product performance metrics");

        Map<String, List<SalesRecord>> groups = ProductGroups.byProduct(records);
        long allUnits = records.stream().mapToLong(SalesRecord::getUnitsSold).sum();

        List<ProductPerformance> rows = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<SalesRecord>> group : groups.entrySet()) {
            rows.add(describe(group.getKey(), group.getValue(), allUnits));
        }

        // stable: equal revenues keep first-appearance order
        rows.sort(Comparator.comparingDouble(ProductPerformance::getTotalRevenue).reversed());
        List<ProductPerformance> ranked = assignRanks(rows);

        PerformanceLeaders leaders = leaders(ranked);
        log.info("Best selling product: {}, highest revenue: {}, most stable: {}",
                leaders.getBestSelling(), leaders.getHighestRevenue(), leaders.getMostStable());

        return PerformanceMetrics.builder()
                .products(ranked)
                .topPerformers(ranked.subList(0, Math.min(topN, ranked.size())))
                .leaders(leaders)
                .build();
    }

    private ProductPerformance describe(String productId, List<SalesRecord> observations, long allUnits) {
        DescriptiveStatistics units = new DescriptiveStatistics();
        DescriptiveStatistics revenue = new DescriptiveStatistics();
        DescriptiveStatistics price = new DescriptiveStatistics();
        long totalUnits = 0;
        for (SalesRecord record : observations) {
            units.addValue(record.getUnitsSold());
            revenue.addValue(record.getRevenue());
            price.addValue(record.getAvgPrice());
            totalUnits += record.getUnitsSold();
        }

        double meanUnits = units.getMean();
        // DescriptiveStatistics reports 0 for a single value; that is not a measured deviation
        MetricValue stdDev = units.getN() > 1
                ? MetricValue.of(units.getStandardDeviation())
                : MetricValue.undefined();
        MetricValue stability = stdDev.isDefined() && meanUnits != 0
                ? MetricValue.of(stdDev.value() / meanUnits)
                : MetricValue.undefined();

        return ProductPerformance.builder()
                .productId(productId)
                .observations(observations.size())
                .totalUnits(totalUnits)
                .meanUnits(meanUnits)
                .unitsStdDev(stdDev)
                .totalRevenue(revenue.getSum())
                .meanRevenue(revenue.getMean())
                .meanPrice(price.getMean())
                .marketShare(allUnits == 0 ? 0 : (double) totalUnits / allUnits * 100)
                .stabilityCoefficient(stability)
                .build();
    }

    /**
     * Expects rows sorted descending by total revenue.
     */
    private static List<ProductPerformance> assignRanks(List<ProductPerformance> sorted) {
        List<ProductPerformance> ranked = new ArrayList<>(sorted.size());
        int rank = 0;
        for (int i = 0; i < sorted.size(); i++) {
            ProductPerformance row = sorted.get(i);
            if (i == 0 || Double.compare(row.getTotalRevenue(), sorted.get(i - 1).getTotalRevenue()) != 0) {
                rank = i + 1;
            }
            ranked.add(row.toBuilder().revenueRank(rank).build());
        }
        return ranked;
    }

    private static PerformanceLeaders leaders(List<ProductPerformance> ranked) {
        if (ranked.isEmpty()) {
            return PerformanceLeaders.none();
        }

        ProductPerformance bestSelling = ranked.get(0);
        ProductPerformance mostStable = null;
        for (ProductPerformance row : ranked) {
            if (row.getTotalUnits() > bestSelling.getTotalUnits()) {
                bestSelling = row;
            }
            MetricValue stability = row.getStabilityCoefficient();
            if (stability.isDefined()
                    && (mostStable == null || stability.value() < mostStable.getStabilityCoefficient().value())) {
                mostStable = row;
            }
        }

        return PerformanceLeaders.builder()
                .bestSelling(bestSelling.getProductId())
                .highestRevenue(ranked.get(0).getProductId())
                .mostStable(mostStable == null ? null : mostStable.getProductId())
                .build();
    }
}
