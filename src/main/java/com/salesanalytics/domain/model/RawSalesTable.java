package com.salesanalytics.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular sales data as read from the source, before any type coercion.
 *
 * Cells are raw text; a cell is null when the source row had no value for it.
 */
public final class RawSalesTable {

    private final List<String> columns;
    private final List<Map<String, String>> rows;

    public RawSalesTable(List<String> columns, List<Map<String, String>> rows) {
        this.columns = List.copyOf(columns);
        List<Map<String, String>> copied = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }
}
