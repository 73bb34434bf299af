package com.packlabels.core.order;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when one or more canonical columns cannot be found among the sheet headers.
 */
public class OrderSchemaException extends IllegalArgumentException {
    private final List<OrderField> missingFields;

    public OrderSchemaException(List<OrderField> missingFields) {
        super("Missing required columns: " + missingFields.stream()
            .map(OrderField::key)
            .collect(Collectors.joining(", ")));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<OrderField> missingFields() {
        return missingFields;
    }
}
