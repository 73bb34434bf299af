package com.packlabels.core.order;

import java.util.Objects;

/**
 * Summed quantities for one customer name.
 */
public record AggregatedOrder(String name, int carryOut, int dineIn) {

    public AggregatedOrder {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (carryOut < 0 || dineIn < 0) {
            throw new IllegalArgumentException("quantities must be >= 0 for " + name);
        }
    }
}
