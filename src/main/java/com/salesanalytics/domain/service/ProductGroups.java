package com.salesanalytics.domain.service;

import com.salesanalytics.domain.model.SalesRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ProductGroups {

    private ProductGroups() {
    }

    /**
     * Records per product, products in first-appearance order, records in dataset order.
     */
    static Map<String, List<SalesRecord>> byProduct(List<SalesRecord> records) {
        Map<String, List<SalesRecord>> groups = new LinkedHashMap<>();
        for (SalesRecord record : records) {
            groups.computeIfAbsent(record.getProductId(), key -> new ArrayList<>()).add(record);
        }
        return groups;
    }
}
