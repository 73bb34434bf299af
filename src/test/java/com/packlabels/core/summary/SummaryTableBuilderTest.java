package com.packlabels.core.summary;

import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.order.AggregatedOrder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummaryTableBuilderTest {

    private final SummaryTableBuilder builder = new SummaryTableBuilder(LabelGrid.LETTER_30_UP);

    @Test
    void listsOnlyPositiveDineInInNameOrder() {
        List<AggregatedOrder> orders = List.of(
            new AggregatedOrder("Amy", 3, 0),
            new AggregatedOrder("Ben", 0, 2),
            new AggregatedOrder("Cal", 1, 5)
        );

        assertEquals(List.of(
            new DineInSummaryEntry("Ben", 2),
            new DineInSummaryEntry("Cal", 5)
        ), SummaryTableBuilder.entriesFrom(orders));
    }

    @Test
    void emptySummaryIsOnePageWithoutEntries() {
        List<SummaryPage> pages = builder.build(List.of(new AggregatedOrder("Amy", 3, 0)));

        assertEquals(1, pages.size());
        assertTrue(pages.get(0).isEmpty());
        assertEquals(SummaryTableBuilder.TITLE, pages.get(0).title());
    }

    @Test
    void tableRowsStartWithHeader() {
        SummaryPage page = new SummaryPage(SummaryTableBuilder.TITLE, List.of(new DineInSummaryEntry("Ben", 2)), false);

        assertEquals(List.of(List.of("Name", "Number"), List.of("Ben", "2")), SummaryTableBuilder.tableRows(page));
    }

    @Test
    void columnsSplitSeventyThirty() {
        float available = 612f - 2 * 14.4f;

        assertArrayEquals(new float[]{available * 0.7f, available * 0.3f}, builder.columnWidths(), 0.01f);
    }

    @Test
    void longSummaryContinuesOnFurtherPages() {
        int perPage = builder.bodyRowsPerPage();
        List<DineInSummaryEntry> entries = new ArrayList<>();
        for (int i = 0; i < perPage + 3; i++) {
            entries.add(new DineInSummaryEntry("Guest %03d".formatted(i), 1));
        }

        List<SummaryPage> pages = builder.paginate(entries);

        assertEquals(2, pages.size());
        assertEquals(perPage, pages.get(0).entries().size());
        assertFalse(pages.get(0).continuation());
        assertEquals(3, pages.get(1).entries().size());
        assertTrue(pages.get(1).continuation());
        assertEquals(SummaryTableBuilder.CONTINUED_TITLE, pages.get(1).title());
    }

    @Test
    void typicalSummaryFitsOnOnePage() {
        assertEquals(26, builder.bodyRowsPerPage());
    }
}
