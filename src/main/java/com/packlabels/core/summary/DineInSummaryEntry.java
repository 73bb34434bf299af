package com.packlabels.core.summary;

import java.util.Objects;

/**
 * One row of the dine-in table.
 */
public record DineInSummaryEntry(String name, int count) {

    public DineInSummaryEntry {
        Objects.requireNonNull(name, "name");
        if (count <= 0) {
            throw new IllegalArgumentException("Dine-in count must be positive for " + name);
        }
    }
}
