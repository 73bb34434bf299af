package com.packlabels.core.layout;

import com.packlabels.core.label.LabelCard;
import com.packlabels.core.pdf.DrawingSurface;
import com.packlabels.core.pdf.SheetFont;
import com.packlabels.core.pdf.TextAlign;

import java.io.IOException;
import java.util.Objects;

import static com.packlabels.core.layout.SheetTypography.BODY_FONT_SIZE;
import static com.packlabels.core.layout.SheetTypography.CONTENT_PADDING;
import static com.packlabels.core.layout.SheetTypography.COUNT_FONT_SIZE;
import static com.packlabels.core.layout.SheetTypography.TITLE_FONT_SIZE;

/**
 * Draws the text of a single label cell.
 * <ul>
 *     <li>Pack summary: title near the top, doubles and singles lines below it.</li>
 *     <li>Continuation: the name, vertically centred.</li>
 *     <li>Primary: the name in the upper part and the count centred below it.</li>
 * </ul>
 */
public class LabelCardRenderer {

    private final LabelGrid grid;

    public LabelCardRenderer(LabelGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    public void draw(DrawingSurface surface, PlacedLabel placed) throws IOException {
        LabelCard card = placed.card();
        float top = surface.pageHeight() - placed.top();
        float bottom = top - grid.cellHeight();
        float centerX = placed.left() + grid.cellWidth() / 2f;

        if (card.isPackSummary()) {
            float titleBaseline = top - CONTENT_PADDING - TITLE_FONT_SIZE * 0.6f;
            surface.drawText(card.name(), centerX, titleBaseline, SheetFont.BOLD, TITLE_FONT_SIZE, TextAlign.CENTER);

            float doublesBaseline = titleBaseline - BODY_FONT_SIZE - 6f;
            float singlesBaseline = doublesBaseline - BODY_FONT_SIZE - 4f;
            surface.drawText("Doubles: " + orZero(card.doubles()), centerX, doublesBaseline,
                SheetFont.REGULAR, BODY_FONT_SIZE, TextAlign.CENTER);
            surface.drawText("Singles: " + orZero(card.singles()), centerX, singlesBaseline,
                SheetFont.REGULAR, BODY_FONT_SIZE, TextAlign.CENTER);
            return;
        }

        if (!card.hasCount()) {
            float nameBaseline = bottom + grid.cellHeight() / 2f - TITLE_FONT_SIZE / 2f;
            surface.drawText(card.name(), centerX, nameBaseline, SheetFont.BOLD, TITLE_FONT_SIZE, TextAlign.CENTER);
            return;
        }

        float nameBaseline = top - CONTENT_PADDING - TITLE_FONT_SIZE;
        surface.drawText(card.name(), centerX, nameBaseline, SheetFont.BOLD, TITLE_FONT_SIZE, TextAlign.CENTER);
        float countBaseline = bottom + grid.cellHeight() / 2f - COUNT_FONT_SIZE * 0.5f;
        surface.drawText(String.valueOf(card.count()), centerX, countBaseline,
            SheetFont.BOLD, COUNT_FONT_SIZE, TextAlign.CENTER);
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
