package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.ColumnMapping;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The cleaning pipeline, in the order it must run. Later steps rely on the
 * earlier ones: duplicates are detected on parsed dates, numbers are only
 * coerced on rows that have every required value.
 */
final class CleaningSteps {

    static final String PARSE_DATES = "parse_dates";
    static final String SORT_BY_DATE = "sort_by_date";
    static final String DROP_MISSING = "drop_missing";
    static final String DROP_DUPLICATES = "drop_duplicates";
    static final String COERCE_NUMERIC = "coerce_numeric";
    static final String DROP_NON_POSITIVE = "drop_non_positive";

    private CleaningSteps() {
    }

    static List<CleaningStep> pipeline(ColumnMapping mapping, List<String> columns, SalesDateParser dateParser) {
        return List.of(
                new ParseDates(mapping, dateParser),
                new SortByDate(),
                new DropMissing(mapping),
                new DropDuplicates(mapping, columns),
                new CoerceNumeric(mapping),
                new DropNonPositive()
        );
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class ParseDates implements CleaningStep {

        private final ColumnMapping mapping;
        private final SalesDateParser dateParser;

        ParseDates(ColumnMapping mapping, SalesDateParser dateParser) {
            this.mapping = mapping;
            this.dateParser = dateParser;
        }

        @Override
        public String name() {
            return PARSE_DATES;
        }

        @Override
        public String reason() {
            return "unparsable date";
        }

        @Override
        public List<StagedRow> apply(List<StagedRow> rows) {
            List<StagedRow> survivors = new ArrayList<>(rows.size());
            for (StagedRow row : rows) {
                Optional<LocalDate> date = dateParser.parse(row.cell(mapping.getDateColumn()));
                date.ifPresent(parsed -> survivors.add(row.withDate(parsed)));
            }
            return survivors;
        }
    }

    private static final class SortByDate implements CleaningStep {

        @Override
        public String name() {
            return SORT_BY_DATE;
        }

        @Override
        public String reason() {
            return "none (reorders rows)";
        }

        @Override
        public List<StagedRow> apply(List<StagedRow> rows) {
            // List.sort is stable: same-day rows keep their source order
            List<StagedRow> sorted = new ArrayList<>(rows);
            sorted.sort(Comparator.comparing(StagedRow::date));
            return sorted;
        }
    }

    private static final class DropMissing implements CleaningStep {

        private final ColumnMapping mapping;

        DropMissing(ColumnMapping mapping) {
            this.mapping = mapping;
        }

        @Override
        public String name() {
            return DROP_MISSING;
        }

        @Override
        public String reason() {
            return "missing units, price or product";
        }

        @Override
        public List<StagedRow> apply(List<StagedRow> rows) {
            List<StagedRow> survivors = new ArrayList<>(rows.size());
            for (StagedRow row : rows) {
                if (isBlank(row.cell(mapping.getUnitsColumn()))
                        || isBlank(row.cell(mapping.getPriceColumn()))
                        || isBlank(row.cell(mapping.getProductColumn()))) {
                    continue;
                }
                survivors.add(row);
            }
            return survivors;
        }
    }

    /**
     * Keeps the first of rows that agree on every column. The date column is
     * compared as the parsed date; every other column as its trimmed raw text,
     * since numbers are not coerced yet. So {@code 10} and {@code 10.0} in the
     * units column are different values here, while {@code 2022-01-01} and
     * {@code 2022-01-01 00:00:00} are the same date.
     */
    private static final class DropDuplicates implements CleaningStep {

        private final ColumnMapping mapping;
        private final List<String> columns;

        DropDuplicates(ColumnMapping mapping, List<String> columns) {
            this.mapping = mapping;
            this.columns = columns;
        }

        @Override
        public String name() {
            return DROP_DUPLICATES;
        }

        @Override
        public String reason() {
            return "exact duplicate";
        }

        @Override
        public List<StagedRow> apply(List<StagedRow> rows) {
            Set<List<Object>> seen = new HashSet<>();
            List<StagedRow> survivors = new ArrayList<>(rows.size());
            for (StagedRow row : rows) {
                if (seen.add(fieldTuple(row))) {
                    survivors.add(row);
                }
            }
            return survivors;
        }

        private List<Object> fieldTuple(StagedRow row) {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                String column = columns.get(i);
                if (column.equals(mapping.getDateColumn())) {
                    values[i] = row.date();
                } else {
                    String cell = row.cell(column);
                    values[i] = cell == null ? null : cell.trim();
                }
            }
            return Arrays.asList(values);
        }
    }

    private static final class CoerceNumeric implements CleaningStep {

        private final ColumnMapping mapping;

        CoerceNumeric(ColumnMapping mapping) {
            this.mapping = mapping;
        }

        @Override
        public String name() {
            return COERCE_NUMERIC;
        }

        @Override
        public String reason() {
            return "non-numeric units or price";
        }

        @Override
        public List<StagedRow> apply(List<StagedRow> rows) {
            List<StagedRow> survivors = new ArrayList<>(rows.size());
            for (StagedRow row : rows) {
                Optional<Long> units = parseUnits(row.cell(mapping.getUnitsColumn()));
                Optional<Double> price = parsePrice(row.cell(mapping.getPriceColumn()));
                if (units.isPresent() && price.isPresent()) {
                    survivors.add(row.withNumbers(units.get(), price.get()));
                }
            }
            return survivors;
        }

        /**
         * Whole numbers only; "120" and "120.0" are accepted, "120.5" is not.
         */
        private static Optional<Long> parseUnits(String text) {
            return parseDecimal(text).flatMap(decimal -> {
                try {
                    return Optional.of(decimal.longValueExact());
                } catch (ArithmeticException e) {
                    return Optional.empty();
                }
            });
        }

        private static Optional<Double> parsePrice(String text) {
            return parseDecimal(text)
                    .map(BigDecimal::doubleValue)
                    .filter(Double::isFinite);
        }

        // BigDecimal rejects NaN, Infinity and Java float suffixes that Double.parseDouble accepts
        private static Optional<BigDecimal> parseDecimal(String text) {
            if (isBlank(text)) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    }

    private static final class DropNonPositive implements CleaningStep {

        @Override
        public String name() {
            return DROP_NON_POSITIVE;
        }

        @Override
        public String reason() {
            return "non-positive units or price";
        }

        @Override
        public List<StagedRow> apply(List<StagedRow> rows) {
            List<StagedRow> survivors = new ArrayList<>(rows.size());
            for (StagedRow row : rows) {
                if (row.units() > 0 && row.price() > 0) {
                    survivors.add(row);
                }
            }
            return survivors;
        }
    }
}
