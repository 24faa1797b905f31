package com.salesanalytics.config;

import com.salesanalytics.domain.model.ColumnMapping;
import com.salesanalytics.domain.service.MetricsEngine;
import com.salesanalytics.domain.service.SalesDateParser;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Sales analysis settings (app.sales.*).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.sales")
public class SalesAnalyticsProperties {

    private Columns columns = new Columns();

    /** Date patterns tried in order; use 'uuuu' for the year. */
    @NotEmpty
    private List<String> dateFormats = new ArrayList<>(SalesDateParser.DEFAULT_PATTERNS);

    @Min(1)
    private int defaultTopN = MetricsEngine.DEFAULT_TOP_N;

    /** TTL of cached analysis reports; 0 disables the cache. */
    @Min(0)
    private long cacheTtlSeconds = 3600;

    public ColumnMapping toColumnMapping() {
        return ColumnMapping.builder()
                .dateColumn(columns.getDate())
                .productColumn(columns.getProduct())
                .unitsColumn(columns.getUnits())
                .priceColumn(columns.getPrice())
                .build();
    }

    @Data
    public static class Columns {

        @NotBlank
        private String date = ColumnMapping.DEFAULT_DATE_COLUMN;

        @NotBlank
        private String product = ColumnMapping.DEFAULT_PRODUCT_COLUMN;

        @NotBlank
        private String units = ColumnMapping.DEFAULT_UNITS_COLUMN;

        @NotBlank
        private String price = ColumnMapping.DEFAULT_PRICE_COLUMN;
    }
}
