package com.packlabels.core.label;

import java.util.List;

/**
 * Cards in print order plus the pack totals they were derived from.
 */
public record LabelSequence(List<LabelCard> cards, PackSplit totals) {

    public LabelSequence {
        cards = List.copyOf(cards);
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public int size() {
        return cards.size();
    }
}
