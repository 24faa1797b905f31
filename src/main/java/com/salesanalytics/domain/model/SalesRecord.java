package com.salesanalytics.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * One cleaned sales observation with its derived calendar and revenue fields.
 */
@Value
@Builder
@Jacksonized
public class SalesRecord {

    LocalDate date;
    String productId;
    long unitsSold;
    double avgPrice;

    double revenue;
    int year;
    int month;
    int quarter;

    /**
     * Builds a record and derives revenue, year, month and quarter from the inputs.
     */
    public static SalesRecord of(LocalDate date, String productId, long unitsSold, double avgPrice) {
        return SalesRecord.builder()
                .date(date)
                .productId(productId)
                .unitsSold(unitsSold)
                .avgPrice(avgPrice)
                .revenue(unitsSold * avgPrice)
                .year(date.getYear())
                .month(date.getMonthValue())
                .quarter((date.getMonthValue() - 1) / 3 + 1)
                .build();
    }
}
