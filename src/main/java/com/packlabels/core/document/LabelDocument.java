package com.packlabels.core.document;

import com.packlabels.core.label.LabelSequence;
import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.layout.LabelPage;
import com.packlabels.core.order.AggregatedOrder;
import com.packlabels.core.summary.DineInSummaryEntry;
import com.packlabels.core.summary.SummaryPage;

import java.util.List;

/**
 * The finished page model for one order sheet: label pages first, then the dine-in summary.
 * Also keeps the intermediate results it was built from so callers can report on them.
 */
public record LabelDocument(LabelGrid grid,
                            List<AggregatedOrder> orders,
                            LabelSequence labels,
                            List<DineInSummaryEntry> summaryEntries,
                            List<DocumentPage> pages) {

    public LabelDocument {
        orders = List.copyOf(orders);
        summaryEntries = List.copyOf(summaryEntries);
        pages = List.copyOf(pages);
    }

    public List<LabelPage> labelPages() {
        return pages.stream()
            .filter(LabelPage.class::isInstance)
            .map(LabelPage.class::cast)
            .toList();
    }

    public List<SummaryPage> summaryPages() {
        return pages.stream()
            .filter(SummaryPage.class::isInstance)
            .map(SummaryPage.class::cast)
            .toList();
    }

    public int pageCount() {
        return pages.size();
    }
}
