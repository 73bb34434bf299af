package com.packlabels.core.layout;

/**
 * Geometry of one label sheet: page size, margins, cell size and gaps, all in points.
 * <p>
 * Cell positions are measured from the page's top-left corner; {@link #cellTop(int)} grows
 * downwards.
 */
public record LabelGrid(int columns,
                        int rows,
                        float cellWidth,
                        float cellHeight,
                        float horizontalGap,
                        float verticalGap,
                        float marginX,
                        float marginY,
                        float pageWidth,
                        float pageHeight) {

    public static final float POINTS_PER_INCH = 72f;

    /**
     * Letter paper, 3 x 10 labels of 2.625 x 1 inch.
     */
    public static final LabelGrid LETTER_30_UP = new LabelGrid(
        3, 10,
        inches(2.625f), inches(1.0f),
        inches(0.1f), 0f,
        inches(0.2f), inches(0.4f),
        inches(8.5f), inches(11f)
    );

    public LabelGrid {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("Grid needs at least one column and one row");
        }
        if (cellWidth <= 0 || cellHeight <= 0 || pageWidth <= 0 || pageHeight <= 0) {
            throw new IllegalArgumentException("Cell and page sizes must be positive");
        }
        if (horizontalGap < 0 || verticalGap < 0 || marginX < 0 || marginY < 0) {
            throw new IllegalArgumentException("Gaps and margins must not be negative");
        }
    }

    public static float inches(float value) {
        return value * POINTS_PER_INCH;
    }

    public int cellsPerPage() {
        return columns * rows;
    }

    /**
     * Where the card at zero-based {@code index} lands: left to right, top to bottom, page by page.
     */
    public GridPosition position(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
        int perPage = cellsPerPage();
        int slot = index % perPage;
        return new GridPosition(index / perPage, slot % columns, slot / columns);
    }

    public float cellLeft(int column) {
        return marginX + column * (cellWidth + horizontalGap);
    }

    public float cellTop(int row) {
        return marginY + row * (cellHeight + verticalGap);
    }

    /**
     * Width left for content between the horizontal page margins.
     */
    public float printableWidth() {
        return pageWidth - 2 * marginX;
    }
}
