package com.packlabels.core.sheet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Headers and raw rows read from an order file. Every row has a value (possibly empty) for every
 * header.
 */
public record OrderSheet(List<String> headers, List<Map<String, String>> rows) {

    public OrderSheet {
        headers = List.copyOf(headers);
        rows = rows.stream()
            .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
            .toList();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Builds a row map for {@code headers}, padding short rows with empty strings. When a header
     * repeats, the first column keeps the value.
     */
    static Map<String, String> toRow(List<String> headers, List<String> values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = i < values.size() && values.get(i) != null ? values.get(i) : "";
            row.putIfAbsent(headers.get(i), value);
        }
        return row;
    }
}
