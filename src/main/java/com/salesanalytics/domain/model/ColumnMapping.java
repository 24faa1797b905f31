package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Maps the four required sales fields onto the column names of a source table.
 */
@Value
@Builder
@Jacksonized
public class ColumnMapping {

    public static final String DEFAULT_DATE_COLUMN = "date";
    public static final String DEFAULT_PRODUCT_COLUMN = "model";
    public static final String DEFAULT_UNITS_COLUMN = "units_sold";
    public static final String DEFAULT_PRICE_COLUMN = "avg_price";

    @Builder.Default
    String dateColumn = DEFAULT_DATE_COLUMN;

    @Builder.Default
    String productColumn = DEFAULT_PRODUCT_COLUMN;

    @Builder.Default
    String unitsColumn = DEFAULT_UNITS_COLUMN;

    @Builder.Default
    String priceColumn = DEFAULT_PRICE_COLUMN;

    public static ColumnMapping defaults() {
        return ColumnMapping.builder().build();
    }

    /**
     * Required columns in validation order.
     */
    public List<String> requiredColumns() {
        return List.of(dateColumn, unitsColumn, priceColumn, productColumn);
    }
}
