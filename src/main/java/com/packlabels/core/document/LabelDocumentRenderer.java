package com.packlabels.core.document;

import com.packlabels.core.layout.LabelCardRenderer;
import com.packlabels.core.layout.LabelPage;
import com.packlabels.core.layout.PlacedLabel;
import com.packlabels.core.pdf.DrawingSurface;
import com.packlabels.core.summary.SummaryPage;
import com.packlabels.core.summary.SummaryPageRenderer;

import java.io.IOException;

/**
 * Draws every page of a {@link LabelDocument} onto a {@link DrawingSurface}, one surface page per
 * document page.
 */
public class LabelDocumentRenderer {

    public void render(LabelDocument document, DrawingSurface surface) throws IOException {
        LabelCardRenderer cardRenderer = new LabelCardRenderer(document.grid());
        SummaryPageRenderer summaryRenderer = new SummaryPageRenderer(document.grid());

        for (DocumentPage page : document.pages()) {
            surface.beginPage();
            if (page instanceof LabelPage labelPage) {
                for (PlacedLabel placed : labelPage.labels()) {
                    cardRenderer.draw(surface, placed);
                }
            } else if (page instanceof SummaryPage summaryPage) {
                summaryRenderer.draw(surface, summaryPage);
            } else {
                throw new IllegalArgumentException("Unsupported page type: " + page.getClass().getName());
            }
            surface.endPage();
        }
    }
}
