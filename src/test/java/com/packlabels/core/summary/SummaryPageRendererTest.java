package com.packlabels.core.summary;

import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.pdf.RecordingDrawingSurface;
import com.packlabels.core.pdf.RecordingDrawingSurface.TableCall;
import com.packlabels.core.pdf.SheetFont;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummaryPageRendererTest {

    private final LabelGrid grid = LabelGrid.LETTER_30_UP;
    private final SummaryPageRenderer renderer = new SummaryPageRenderer(grid);
    private RecordingDrawingSurface surface;

    @BeforeEach
    void setUp() {
        surface = new RecordingDrawingSurface(grid.pageWidth(), grid.pageHeight());
        surface.beginPage();
    }

    @Test
    void emptySummaryPrintsMessage() throws IOException {
        renderer.draw(surface, new SummaryPage(SummaryTableBuilder.TITLE, List.of(), false));

        assertEquals(List.of("Dine-In Summary", "No dine-in orders."), surface.textsOnPage(0));
        assertTrue(surface.tables().isEmpty());
        assertEquals(SheetFont.BOLD, surface.texts().get(0).font());
        assertEquals(18f, surface.texts().get(0).size(), 0.001f);
        assertEquals(792f - 28.8f, surface.texts().get(0).baseline(), 0.001f);
        assertEquals(792f - 28.8f - 30f, surface.texts().get(1).baseline(), 0.001f);
    }

    @Test
    void entriesAreDrawnAsTableBelowTitle() throws IOException {
        renderer.draw(surface, new SummaryPage(SummaryTableBuilder.TITLE,
            List.of(new DineInSummaryEntry("Alice", 2), new DineInSummaryEntry("Bob", 1)), false));

        assertEquals(1, surface.tables().size());
        TableCall table = surface.tables().get(0);
        assertEquals(List.of(List.of("Name", "Number"), List.of("Alice", "2"), List.of("Bob", "1")), table.rows());
        assertEquals(14.4f, table.x(), 0.001f);
        assertEquals(792f - 28.8f - 30f, table.top(), 0.001f);
        assertTrue(table.style().isCentered(1));
        assertEquals(SheetFont.BOLD, table.style().headerFont());
    }
}
