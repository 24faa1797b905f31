package com.salesanalytics.domain.service;

import java.time.LocalDate;
import java.util.Map;

/**
 * A raw row moving through the cleaning steps, carrying whatever has been parsed so far.
 */
final class StagedRow {

    private final int sourceIndex;
    private final Map<String, String> cells;
    private final LocalDate date;
    private final Long units;
    private final Double price;

    StagedRow(int sourceIndex, Map<String, String> cells) {
        this(sourceIndex, cells, null, null, null);
    }

    private StagedRow(int sourceIndex, Map<String, String> cells, LocalDate date, Long units, Double price) {
        this.sourceIndex = sourceIndex;
        this.cells = cells;
        this.date = date;
        this.units = units;
        this.price = price;
    }

    StagedRow withDate(LocalDate parsedDate) {
        return new StagedRow(sourceIndex, cells, parsedDate, units, price);
    }

    StagedRow withNumbers(long parsedUnits, double parsedPrice) {
        return new StagedRow(sourceIndex, cells, date, parsedUnits, parsedPrice);
    }

    int sourceIndex() {
        return sourceIndex;
    }

    String cell(String column) {
        return cells.get(column);
    }

    Map<String, String> cells() {
        return cells;
    }

    LocalDate date() {
        return date;
    }

    Long units() {
        return units;
    }

    Double price() {
        return price;
    }
}
