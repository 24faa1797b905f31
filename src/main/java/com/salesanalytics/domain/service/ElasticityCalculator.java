package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.ElasticityClassification;
import com.salesanalytics.domain.model.ElasticityMetric;
import com.salesanalytics.domain.model.MetricValue;
import com.salesanalytics.domain.model.SalesRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Price elasticity of demand per product.
 *
 * Elasticity = mean over consecutive observations of (units % change / price % change).
 * Pairs where either change is undefined, or the price did not move, carry no
 * evidence and are skipped. A product left with no pairs is omitted.
 */
@Slf4j
class ElasticityCalculator {

    Map<String, ElasticityMetric> calculate(List<SalesRecord> records) {
        log.info("Calculating price elasticity");

        Map<String, ElasticityMetric> elasticity = new LinkedHashMap<>();
        for (Map.Entry<String, List<SalesRecord>> product : ProductGroups.byProduct(records).entrySet()) {
            String productId = product.getKey();
            List<SalesRecord> observations = product.getValue();

            if (observations.size() < 2) {
                log.debug("Insufficient data for elasticity calculation: {}", productId);
                continue;
            }

            DescriptiveStatistics ratios = new DescriptiveStatistics();
            for (int i = 1; i < observations.size(); i++) {
                SalesRecord previous = observations.get(i - 1);
                SalesRecord current = observations.get(i);

                MetricValue priceChange = PercentChange.between(previous.getAvgPrice(), current.getAvgPrice());
                MetricValue unitsChange = PercentChange.between(previous.getUnitsSold(), current.getUnitsSold());
                if (!priceChange.isDefined() || !unitsChange.isDefined() || priceChange.value() == 0) {
                    continue;
                }
                ratios.addValue(unitsChange.value() / priceChange.value());
            }

            if (ratios.getN() == 0) {
                log.debug("No valid elasticity data for product: {}", productId);
                continue;
            }

            double coefficient = ratios.getMean();
            elasticity.put(productId, ElasticityMetric.builder()
                    .productId(productId)
                    .coefficient(coefficient)
                    .classification(ElasticityClassification.of(coefficient))
                    .meanPrice(observations.stream().mapToDouble(SalesRecord::getAvgPrice).average().orElse(0))
                    .meanUnits(observations.stream().mapToLong(SalesRecord::getUnitsSold).average().orElse(0))
                    .observationPairs((int) ratios.getN())
                    .build());
        }

        log.info("Calculated elasticity for {} products", elasticity.size());
        return elasticity;
    }
}
