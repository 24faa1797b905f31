package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Price elasticity of demand for one product.
 *
 * Mean price and mean units describe the product over all its observations;
 * they are context and do not enter the coefficient.
 */
@Value
@Builder
@Jacksonized
public class ElasticityMetric {

    String productId;
    double coefficient;
    ElasticityClassification classification;
    double meanPrice;
    double meanUnits;
    int observationPairs;
}
