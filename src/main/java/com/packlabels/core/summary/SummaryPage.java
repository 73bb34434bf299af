package com.packlabels.core.summary;

import com.packlabels.core.document.DocumentPage;

import java.util.List;

/**
 * A dine-in summary page. The first page of an empty summary carries no entries and shows the
 * "no orders" message instead of a table.
 */
public record SummaryPage(String title, List<DineInSummaryEntry> entries, boolean continuation) implements DocumentPage {

    public SummaryPage {
        entries = List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
