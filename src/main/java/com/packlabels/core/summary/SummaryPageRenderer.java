package com.packlabels.core.summary;

import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.pdf.DrawingSurface;
import com.packlabels.core.pdf.SheetFont;
import com.packlabels.core.pdf.TextAlign;

import java.io.IOException;
import java.util.Objects;

import static com.packlabels.core.layout.SheetTypography.SUMMARY_BODY_FONT_SIZE;
import static com.packlabels.core.layout.SheetTypography.SUMMARY_TITLE_FONT_SIZE;

/**
 * Draws a {@link SummaryPage}: the title at the top margin, then the table or the empty message.
 */
public class SummaryPageRenderer {

    private final LabelGrid grid;
    private final SummaryTableBuilder builder;

    public SummaryPageRenderer(LabelGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.builder = new SummaryTableBuilder(grid);
    }

    public void draw(DrawingSurface surface, SummaryPage page) throws IOException {
        float pageHeight = surface.pageHeight();
        surface.drawText(page.title(), grid.marginX(), pageHeight - grid.marginY(),
            SheetFont.BOLD, SUMMARY_TITLE_FONT_SIZE, TextAlign.LEFT);

        float startY = pageHeight - builder.contentTopOffset();
        if (page.isEmpty()) {
            surface.drawText(SummaryTableBuilder.EMPTY_MESSAGE, grid.marginX(), startY,
                SheetFont.REGULAR, SUMMARY_BODY_FONT_SIZE, TextAlign.LEFT);
            return;
        }
        surface.drawTable(SummaryTableBuilder.tableRows(page), grid.marginX(), startY,
            builder.columnWidths(), SummaryTableBuilder.TABLE_STYLE);
    }
}
