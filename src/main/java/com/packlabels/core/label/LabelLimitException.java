package com.packlabels.core.label;

/**
 * Raised before any card is built when the orders would need more labels than the configured
 * ceiling allows.
 */
public class LabelLimitException extends IllegalArgumentException {
    private final long requiredLabels;
    private final int maxLabels;

    public LabelLimitException(long requiredLabels, int maxLabels, String largestName) {
        super("The orders need %d labels, more than the limit of %d (largest order: %s)"
            .formatted(requiredLabels, maxLabels, largestName));
        this.requiredLabels = requiredLabels;
        this.maxLabels = maxLabels;
    }

    public long getRequiredLabels() {
        return requiredLabels;
    }

    public int getMaxLabels() {
        return maxLabels;
    }
}
