package com.packlabels.core.pdf;

import java.awt.Color;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Visual treatment of a grid table: header emphasis, row shading, borders and cell padding.
 *
 * @param centeredColumns zero-based columns whose text is centred (header included)
 */
public record TableStyle(SheetFont headerFont,
                         SheetFont bodyFont,
                         float fontSize,
                         Color headerBackground,
                         List<Color> rowBackgrounds,
                         Color borderColor,
                         float boxLineWidth,
                         float gridLineWidth,
                         float paddingX,
                         float paddingY,
                         Set<Integer> centeredColumns) {

    private static final float LEADING = 1.2f;

    public TableStyle {
        Objects.requireNonNull(headerFont, "headerFont");
        Objects.requireNonNull(bodyFont, "bodyFont");
        Objects.requireNonNull(borderColor, "borderColor");
        rowBackgrounds = List.copyOf(rowBackgrounds);
        centeredColumns = Set.copyOf(centeredColumns);
        if (fontSize <= 0) {
            throw new IllegalArgumentException("fontSize must be positive");
        }
    }

    /**
     * Height of every table row: one line of text plus top and bottom padding.
     */
    public float rowHeight() {
        return fontSize * LEADING + 2 * paddingY;
    }

    public boolean isCentered(int column) {
        return centeredColumns.contains(column);
    }

    /**
     * Background of body row {@code bodyIndex} (zero-based, header excluded), or {@code null}.
     */
    public Color bodyBackground(int bodyIndex) {
        if (rowBackgrounds.isEmpty()) {
            return null;
        }
        return rowBackgrounds.get(bodyIndex % rowBackgrounds.size());
    }
}
