package com.packlabels.core.layout;

import com.packlabels.core.label.LabelCard;

/**
 * A card assigned to a cell. {@code left} and {@code top} are measured from the page's top-left
 * corner.
 */
public record PlacedLabel(int index, LabelCard card, GridPosition position, float left, float top) {
}
