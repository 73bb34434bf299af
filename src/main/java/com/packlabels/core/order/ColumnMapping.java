package com.packlabels.core.order;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Canonical field to original sheet header, as resolved by {@link SchemaNormalizer}.
 */
public final class ColumnMapping {
    private final Map<OrderField, String> headers;

    ColumnMapping(Map<OrderField, String> headers) {
        this.headers = Collections.unmodifiableMap(new EnumMap<>(headers));
    }

    public String headerFor(OrderField field) {
        return headers.get(field);
    }

    @Override
    public String toString() {
        return headers.toString();
    }
}
