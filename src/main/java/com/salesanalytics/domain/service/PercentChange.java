package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.MetricValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Period-over-period percentage change: {@code (v(t) - v(t-1)) / v(t-1) * 100}.
 */
final class PercentChange {

    private PercentChange() {
    }

    /**
     * Undefined when the previous value is zero.
     */
    static MetricValue between(double previous, double current) {
        return MetricValue.of((current - previous) / previous * 100);
    }

    /**
     * Change series aligned with the input; the first entry is always undefined.
     */
    static List<MetricValue> series(double[] values) {
        List<MetricValue> changes = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            changes.add(i == 0 ? MetricValue.undefined() : between(values[i - 1], values[i]));
        }
        return changes;
    }

    /**
     * Arithmetic mean of the defined values; undefined if there are none.
     */
    static MetricValue meanOfDefined(List<MetricValue> values) {
        double sum = 0;
        int count = 0;
        for (MetricValue value : values) {
            if (value.isDefined()) {
                sum += value.value();
                count++;
            }
        }
        return count == 0 ? MetricValue.undefined() : MetricValue.of(sum / count);
    }
}
