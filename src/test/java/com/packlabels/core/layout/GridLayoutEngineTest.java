package com.packlabels.core.layout;

import com.packlabels.core.label.LabelCard;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridLayoutEngineTest {

    private final LabelGrid grid = LabelGrid.LETTER_30_UP;
    private final GridLayoutEngine engine = new GridLayoutEngine(grid);

    @Test
    void letterGeometryMatchesLabelStock() {
        assertEquals(30, grid.cellsPerPage());
        assertEquals(612f, grid.pageWidth(), 0.001f);
        assertEquals(792f, grid.pageHeight(), 0.001f);
        assertEquals(189f, grid.cellWidth(), 0.001f);
        assertEquals(72f, grid.cellHeight(), 0.001f);
        assertEquals(14.4f, grid.cellLeft(0), 0.001f);
        assertEquals(14.4f + 2 * (189f + 7.2f), grid.cellLeft(2), 0.001f);
        assertEquals(28.8f + 9 * 72f, grid.cellTop(9), 0.001f);
    }

    @Test
    void placementFollowsRowMajorOrderAcrossPages() {
        for (int i = 0; i < 95; i++) {
            GridPosition position = grid.position(i);
            int slot = i % 30;
            assertEquals(i / 30, position.page());
            assertEquals(slot % 3, position.column());
            assertEquals(slot / 3, position.row());
        }
    }

    @Test
    void thirtyOneCardsSpillOntoSecondPage() {
        List<LabelCard> cards = new ArrayList<>();
        for (int i = 0; i < 31; i++) {
            cards.add(LabelCard.primary("Guest %02d".formatted(i), 1));
        }
        cards.add(LabelCard.packSummary(0, 31));

        List<LabelPage> pages = engine.layout(cards);

        assertEquals(2, pages.size());
        assertEquals(30, pages.get(0).labels().size());
        assertEquals(2, pages.get(1).labels().size());

        PlacedLabel last = pages.get(0).labels().get(29);
        assertEquals(new GridPosition(0, 2, 9), last.position());

        PlacedLabel spill = pages.get(1).labels().get(0);
        assertEquals(30, spill.index());
        assertEquals(new GridPosition(1, 0, 0), spill.position());
        assertEquals("Guest 30", spill.card().name());
        assertTrue(pages.get(1).labels().get(1).card().isPackSummary());
        assertEquals(new GridPosition(1, 1, 0), pages.get(1).labels().get(1).position());
    }

    @Test
    void exactlyFullPageDoesNotOpenAnEmptyOne() {
        List<LabelCard> cards = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            cards.add(LabelCard.continuation("Guest"));
        }

        assertEquals(1, engine.layout(cards).size());
    }

    @Test
    void noCardsMeansNoPages() {
        assertTrue(engine.layout(List.of()).isEmpty());
    }

    @Test
    void customGridIsHonoured() {
        LabelGrid small = new LabelGrid(2, 2, 100f, 50f, 10f, 5f, 20f, 30f, 300f, 300f);
        List<LabelCard> cards = List.of(
            LabelCard.primary("A", 2),
            LabelCard.primary("B", 2),
            LabelCard.primary("C", 2),
            LabelCard.primary("D", 2),
            LabelCard.primary("E", 2)
        );

        List<LabelPage> pages = new GridLayoutEngine(small).layout(cards);

        assertEquals(2, pages.size());
        PlacedLabel fourth = pages.get(0).labels().get(3);
        assertEquals(130f, fourth.left(), 0.001f);
        assertEquals(85f, fourth.top(), 0.001f);
    }

    @Test
    void rejectsDegenerateGrid() {
        assertThrows(IllegalArgumentException.class,
            () -> new LabelGrid(0, 10, 1f, 1f, 0f, 0f, 0f, 0f, 10f, 10f));
    }
}
