package com.packlabels.core.layout;

import com.packlabels.core.label.LabelCard;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Places a flat card sequence onto grid cells, filling each page before starting the next.
 */
public class GridLayoutEngine {

    private final LabelGrid grid;

    public GridLayoutEngine(LabelGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    public LabelGrid grid() {
        return grid;
    }

    public List<LabelPage> layout(List<LabelCard> cards) {
        List<LabelPage> pages = new ArrayList<>();
        List<PlacedLabel> current = new ArrayList<>();
        int pageIndex = 0;

        for (int i = 0; i < cards.size(); i++) {
            GridPosition position = grid.position(i);
            if (i > 0 && position.column() == 0 && position.row() == 0) {
                pages.add(new LabelPage(pageIndex, current));
                current = new ArrayList<>();
                pageIndex++;
            }
            current.add(new PlacedLabel(
                i,
                cards.get(i),
                position,
                grid.cellLeft(position.column()),
                grid.cellTop(position.row())
            ));
        }

        if (!current.isEmpty()) {
            pages.add(new LabelPage(pageIndex, current));
        }
        return pages;
    }
}
