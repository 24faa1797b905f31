package com.salesanalytics.domain.service;

import com.salesanalytics.domain.exception.DatasetValidationException;
import com.salesanalytics.domain.model.CleanedDataset;
import com.salesanalytics.domain.model.CleaningReport;
import com.salesanalytics.domain.model.CleaningStepResult;
import com.salesanalytics.domain.model.ColumnMapping;
import com.salesanalytics.domain.model.DatasetSummary;
import com.salesanalytics.domain.model.RawSalesTable;
import com.salesanalytics.domain.model.SalesRecord;
import com.salesanalytics.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw sales table into a {@link CleanedDataset}.
 *
 * Cleaning Flow:
 * 1. Parse dates (unparsable rows dropped)
 * 2. Stable sort by date
 * 3. Drop rows missing units, price or product
 * 4. Drop exact duplicates
 * 5. Coerce units and price to numbers (failures dropped)
 * 6. Drop non-positive units or price
 * 7. Derive revenue, year, month, quarter
 *
 * Row defects never fail a run; every drop is counted in the {@link CleaningReport}.
 * The only hard failure is a missing required column.
 */
@Slf4j
public class DatasetPreparer {

    private final ColumnMapping mapping;
    private final SalesDateParser dateParser;

    public DatasetPreparer(ColumnMapping mapping) {
        this(mapping, new SalesDateParser());
    }

    public DatasetPreparer(ColumnMapping mapping, SalesDateParser dateParser) {
        this.mapping = mapping;
        this.dateParser = dateParser;
    }

    /**
     * Check that every required column is present. Row values are not inspected.
     */
    public ValidationResult validate(RawSalesTable raw) {
        log.info("Validating data structure");

        List<String> errors = new ArrayList<>();
        for (String column : mapping.requiredColumns()) {
            if (!raw.hasColumn(column)) {
                errors.add("Missing required column: " + column);
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Validation errors: {}", errors);
            return ValidationResult.failed(errors);
        }

        log.info("Data validation passed");
        return ValidationResult.passed();
    }

    /**
     * Clean the table.
     *
     * @throws DatasetValidationException if a required column is missing
     */
    public CleanedDataset clean(RawSalesTable raw) {
        ValidationResult validation = validate(raw);
        if (!validation.isOk()) {
            throw new DatasetValidationException(validation.getErrors());
        }

        log.info("Starting data cleaning of {} rows", raw.size());

        List<StagedRow> rows = new ArrayList<>(raw.size());
        int index = 0;
        for (Map<String, String> cells : raw.getRows()) {
            rows.add(new StagedRow(index++, cells));
        }

        CleaningReport.CleaningReportBuilder report = CleaningReport.builder()
                .rawRowCount(raw.size());

        for (CleaningStep step : CleaningSteps.pipeline(mapping, raw.getColumns(), dateParser)) {
            int before = rows.size();
            rows = step.apply(rows);
            int dropped = before - rows.size();

            if (dropped > 0) {
                log.info("Removed {} rows: {}", dropped, step.reason());
            } else {
                log.debug("Step {} removed no rows", step.name());
            }

            report.step(CleaningStepResult.builder()
                    .step(step.name())
                    .reason(step.reason())
                    .rowsBefore(before)
                    .rowsDropped(dropped)
                    .build());
        }

        List<SalesRecord> records = new ArrayList<>(rows.size());
        for (StagedRow row : rows) {
            records.add(SalesRecord.of(
                    row.date(),
                    row.cell(mapping.getProductColumn()).trim(),
                    row.units(),
                    row.price()));
        }

        CleanedDataset dataset = new CleanedDataset(records, report.cleanedRowCount(records.size()).build());
        log.info("Data cleaning complete. Final dataset: {} rows", dataset.size());
        return dataset;
    }

    /**
     * Headline figures of a cleaned dataset; zero-valued for an empty one.
     */
    public DatasetSummary summarize(CleanedDataset cleaned) {
        if (cleaned.isEmpty()) {
            log.warn("Cleaned dataset is empty, returning empty summary");
            return DatasetSummary.empty();
        }

        List<SalesRecord> records = cleaned.getRecords();
        long totalUnits = 0;
        double totalRevenue = 0;
        double priceSum = 0;
        for (SalesRecord record : records) {
            totalUnits += record.getUnitsSold();
            totalRevenue += record.getRevenue();
            priceSum += record.getAvgPrice();
        }

        DatasetSummary summary = DatasetSummary.builder()
                .totalRows(records.size())
                // records are sorted by date
                .startDate(records.get(0).getDate())
                .endDate(records.get(records.size() - 1).getDate())
                .productCount((int) records.stream().map(SalesRecord::getProductId).distinct().count())
                .totalUnitsSold(totalUnits)
                .totalRevenue(totalRevenue)
                .meanPrice(priceSum / records.size())
                .build();

        log.debug("Data summary: {}", summary);
        return summary;
    }

    public ColumnMapping getMapping() {
        return mapping;
    }
}
