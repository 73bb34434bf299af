package com.packlabels.core.order;

/**
 * Canonical columns every order sheet must resolve to.
 */
public enum OrderField {
    NAME("name"),
    CARRY_OUT("carry_out"),
    DINE_IN("dine_in");

    private final String key;

    OrderField(String key) {
        this.key = key;
    }

    /**
     * Canonical column name as it appears in error messages and configuration keys.
     */
    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
