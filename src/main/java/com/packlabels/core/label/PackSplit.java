package com.packlabels.core.label;

/**
 * How a carry-out quantity packs: every two items go in a double, an odd leftover is a single.
 * Each double or single takes one physical label.
 */
public record PackSplit(int doubles, int singles) {

    public static final PackSplit NONE = new PackSplit(0, 0);

    public static PackSplit of(int carryOut) {
        if (carryOut <= 0) {
            return NONE;
        }
        return new PackSplit(carryOut / 2, carryOut % 2);
    }

    /**
     * Number of labels needed for the quantity, {@code ceil(carryOut / 2)}.
     */
    public static int requiredLabels(int carryOut) {
        return of(carryOut).labelCount();
    }

    public int labelCount() {
        return saturate((long) doubles + singles);
    }

    public long itemCount() {
        return doubles * 2L + singles;
    }

    /**
     * Component-wise sum, capped at {@link Integer#MAX_VALUE}.
     */
    PackSplit plus(PackSplit other) {
        return new PackSplit(saturate((long) doubles + other.doubles), saturate((long) singles + other.singles));
    }

    private static int saturate(long value) {
        return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }

    public boolean isEmpty() {
        return doubles == 0 && singles == 0;
    }
}
