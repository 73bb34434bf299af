package com.packlabels.core.order;

/**
 * One sheet row after header substitution. Values are still the raw cell strings.
 */
public record CanonicalOrderRow(String name, String carryOut, String dineIn) {

    public CanonicalOrderRow {
        name = name == null ? "" : name;
        carryOut = carryOut == null ? "" : carryOut;
        dineIn = dineIn == null ? "" : dineIn;
    }
}
