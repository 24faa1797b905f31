package com.salesanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ElasticityClassification {

    ELASTIC("elastic"),
    INELASTIC("inelastic");

    private final String label;

    ElasticityClassification(String label) {
        this.label = label;
    }

    /**
     * Elastic only when the magnitude is strictly greater than 1.
     */
    public static ElasticityClassification of(double coefficient) {
        return Math.abs(coefficient) > 1.0 ? ELASTIC : INELASTIC;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
