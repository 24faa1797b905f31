package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the engine derives from one cleaned dataset.
 *
 * Elasticity keys appear in first-appearance order of the products and only
 * for products with enough evidence to compute a coefficient.
 */
@Value
public class MetricsResult {

    TrendMetrics trends;
    Map<String, ElasticityMetric> elasticity;
    PerformanceMetrics performance;

    @Builder
    @Jacksonized
    public MetricsResult(TrendMetrics trends, Map<String, ElasticityMetric> elasticity, PerformanceMetrics performance) {
        this.trends = trends;
        this.elasticity = Collections.unmodifiableMap(new LinkedHashMap<>(elasticity));
        this.performance = performance;
    }
}
