package com.packlabels.core.pdf;

/**
 * Horizontal anchoring of a text run relative to its x coordinate.
 */
public enum TextAlign {
    LEFT,
    CENTER,
    RIGHT
}
