package com.packlabels.core.label;

import com.packlabels.core.order.AggregatedOrder;
import com.packlabels.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Expands aggregated orders into the label cards that go on the sheet.
 * <p>
 * For each name with carry-out items: one primary card showing the total, then blank continuation
 * cards until there is one label per double/single. A pack summary card closes the sequence when
 * anything was packed.
 * <p>
 * The total card count, pack summary included, is checked against a ceiling before any card is
 * created.
 */
public class LabelCardSequencer {
    private static final Logger LOGGER = AppLogger.get();

    public static final int DEFAULT_MAX_LABELS = 10_000;

    private final int maxLabels;

    public LabelCardSequencer() {
        this(DEFAULT_MAX_LABELS);
    }

    public LabelCardSequencer(int maxLabels) {
        if (maxLabels <= 0) {
            throw new IllegalArgumentException("maxLabels must be positive: " + maxLabels);
        }
        this.maxLabels = maxLabels;
    }

    public int maxLabels() {
        return maxLabels;
    }

    /**
     * @throws LabelLimitException when the orders need more than {@link #maxLabels()} cards
     */
    public LabelSequence sequence(List<AggregatedOrder> orders) {
        checkLimit(orders);
        List<LabelCard> cards = new ArrayList<>();
        PackSplit totals = PackSplit.NONE;

        for (AggregatedOrder order : orders) {
            int carryOut = order.carryOut();
            if (carryOut <= 0) {
                continue;
            }
            PackSplit split = PackSplit.of(carryOut);
            totals = totals.plus(split);

            cards.add(LabelCard.primary(order.name(), carryOut));
            for (int i = 1; i < split.labelCount(); i++) {
                cards.add(LabelCard.continuation(order.name()));
            }
        }

        if (!totals.isEmpty()) {
            cards.add(LabelCard.packSummary(totals.doubles(), totals.singles()));
        }
        PackSplit packed = totals;
        LOGGER.fine(() -> "Sequenced %d label card(s): %d double(s), %d single(s)"
            .formatted(cards.size(), packed.doubles(), packed.singles()));
        return new LabelSequence(cards, totals);
    }

    private void checkLimit(List<AggregatedOrder> orders) {
        long required = 0;
        AggregatedOrder largest = null;
        for (AggregatedOrder order : orders) {
            int labels = PackSplit.requiredLabels(order.carryOut());
            required += labels;
            if (labels > 0 && (largest == null || order.carryOut() > largest.carryOut())) {
                largest = order;
            }
        }
        if (required > 0) {
            required++;
        }
        if (required > maxLabels) {
            throw new LabelLimitException(required, maxLabels, largest.name());
        }
    }
}
