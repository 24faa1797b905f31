package com.salesanalytics.domain.service;

import com.salesanalytics.config.SalesAnalyticsProperties;
import com.salesanalytics.domain.exception.SalesAnalyticsException;
import com.salesanalytics.domain.exception.SalesDataReadException;
import com.salesanalytics.domain.model.AnalysisReport;
import com.salesanalytics.domain.model.CleanedDataset;
import com.salesanalytics.domain.model.CleaningStepResult;
import com.salesanalytics.domain.model.ColumnMapping;
import com.salesanalytics.domain.model.DatasetOverview;
import com.salesanalytics.domain.model.DatasetSummary;
import com.salesanalytics.domain.model.MetricsResult;
import com.salesanalytics.domain.model.RawSalesTable;
import com.salesanalytics.domain.model.ValidationResult;
import com.salesanalytics.infrastructure.cache.AnalysisCacheService;
import com.salesanalytics.infrastructure.io.SalesCsvReader;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs the sales analysis pipeline over uploaded CSV data.
 *
 * Analysis Flow:
 * 1. Generate cache key from data digest and parameters
 * 2. Check cache (Redis)
 * 3. On miss: read CSV, validate, clean, summarize, derive metrics
 * 4. Store result in cache
 * 5. Return result
 *
 * Every run builds its own {@link DatasetPreparer} and {@link MetricsEngine};
 * this bean holds configuration only, so concurrent runs share nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final SalesCsvReader csvReader;
    private final AnalysisCacheService cacheService;
    private final MeterRegistry meterRegistry;
    private final SalesAnalyticsProperties properties;

    /**
     * Column check only; no rows are cleaned.
     */
    public ValidationResult validate(String csvContent) {
        RawSalesTable raw = csvReader.read(csvContent);
        return newPreparer().validate(raw);
    }

    /**
     * Clean the data and return its summary with the drop counts of each step.
     */
    public DatasetOverview overview(String csvContent) {
        DatasetPreparer preparer = newPreparer();
        CleanedDataset cleaned = preparer.clean(csvReader.read(csvContent));
        recordDrops(cleaned);

        return DatasetOverview.builder()
                .dataSummary(preparer.summarize(cleaned))
                .cleaning(cleaned.getReport())
                .build();
    }

    /**
     * Full analysis with caching.
     *
     * @param topN size of the top performers slice; configured default when null
     */
    public AnalysisReport analyze(String csvContent, Integer topN) {
        if (csvContent == null || csvContent.isBlank()) {
            throw new SalesDataReadException("Sales data is empty");
        }
        int effectiveTopN = topN != null ? topN : properties.getDefaultTopN();
        if (effectiveTopN < 1) {
            throw new IllegalArgumentException("topN must be at least 1, was " + effectiveTopN);
        }

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            String cacheKey = cacheService.keyFor(csvContent, properties.toColumnMapping(),
                    properties.getDateFormats(), effectiveTopN);

            Optional<AnalysisReport> cached = cacheService.lookup(cacheKey);

            if (cached.isPresent()) {
                log.debug("Cache hit for analysis: {}", cacheKey);

                Counter.builder("analysis.cache")
                        .tag("result", "hit")
                        .register(meterRegistry)
                        .increment();

                sample.stop(Timer.builder("analysis.latency")
                        .tag("cached", "true")
                        .register(meterRegistry));

                return cached.get();
            }

            log.debug("Cache miss for analysis: {}", cacheKey);

            Counter.builder("analysis.cache")
                    .tag("result", "miss")
                    .register(meterRegistry)
                    .increment();

            long startTime = System.currentTimeMillis();

            AnalysisReport report = runAnalysis(csvContent, effectiveTopN);
            report.setAnalysisTimeMs(System.currentTimeMillis() - startTime);

            cacheService.store(cacheKey, report);

            sample.stop(Timer.builder("analysis.latency")
                    .tag("cached", "false")
                    .register(meterRegistry));

            Counter.builder("analysis.executed")
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();

            log.info("Analysis executed: {} records, {} ms",
                    report.getDataSummary().getTotalRows(), report.getAnalysisTimeMs());

            return report;

        } catch (SalesAnalyticsException e) {
            log.warn("Analysis rejected: {}", e.getMessage());
            countFailure();
            throw e;

        } catch (RuntimeException e) {
            log.error("Error executing analysis: {}", e.getMessage(), e);
            countFailure();
            throw new SalesAnalyticsException("Analysis failed", e);
        }
    }

    /**
     * The uncached pipeline: read, validate, clean, summarize, derive metrics.
     */
    AnalysisReport runAnalysis(String csvContent, int topN) {
        log.info("STEP 1: Data loading and cleaning");
        DatasetPreparer preparer = newPreparer();
        CleanedDataset cleaned = preparer.clean(csvReader.read(csvContent));
        recordDrops(cleaned);
        DatasetSummary summary = preparer.summarize(cleaned);
        log.info("Data summary: {}", summary);

        log.info("STEP 2: Metrics calculation");
        MetricsResult metrics = new MetricsEngine(cleaned).calculateAll(topN);

        return AnalysisReport.builder()
                .dataSummary(summary)
                .cleaning(cleaned.getReport())
                .metrics(metrics)
                .metricsSummary(MetricsEngine.summarize(metrics))
                .cached(false)
                .build();
    }

    private DatasetPreparer newPreparer() {
        ColumnMapping mapping = properties.toColumnMapping();
        return new DatasetPreparer(mapping, new SalesDateParser(properties.getDateFormats()));
    }

    private void recordDrops(CleanedDataset cleaned) {
        for (CleaningStepResult step : cleaned.getReport().getSteps()) {
            if (step.getRowsDropped() > 0) {
                Counter.builder("dataset.rows.dropped")
                        .tag("step", step.getStep())
                        .register(meterRegistry)
                        .increment(step.getRowsDropped());
            }
        }
    }

    private void countFailure() {
        Counter.builder("analysis.executed")
                .tag("result", "error")
                .register(meterRegistry)
                .increment();
    }
}
