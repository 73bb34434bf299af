package com.packlabels.core.summary;

import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.order.AggregatedOrder;
import com.packlabels.core.pdf.SheetFont;
import com.packlabels.core.pdf.TableStyle;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.packlabels.core.layout.SheetTypography.SUMMARY_BODY_FONT_SIZE;
import static com.packlabels.core.layout.SheetTypography.SUMMARY_TITLE_FONT_SIZE;

/**
 * Builds the dine-in report that follows the label pages.
 * <p>
 * Only names with a positive dine-in count are listed, in aggregate (name) order. Rows that do not
 * fit under the title continue on further pages which repeat the header row.
 */
public class SummaryTableBuilder {

    public static final String TITLE = "Dine-In Summary";
    public static final String CONTINUED_TITLE = TITLE + " (continued)";
    public static final String EMPTY_MESSAGE = "No dine-in orders.";
    public static final List<String> HEADER = List.of("Name", "Number");

    static final float NAME_COLUMN_SHARE = 0.7f;
    static final float TITLE_GAP = 12f;

    public static final TableStyle TABLE_STYLE = new TableStyle(
        SheetFont.BOLD,
        SheetFont.REGULAR,
        SUMMARY_BODY_FONT_SIZE,
        Color.LIGHT_GRAY,
        List.of(Color.WHITE, new Color(0xF3, 0xF4, 0xF6)),
        Color.GRAY,
        1f,
        0.5f,
        8f,
        6f,
        Set.of(1)
    );

    private final LabelGrid grid;

    public SummaryTableBuilder(LabelGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    public static List<DineInSummaryEntry> entriesFrom(List<AggregatedOrder> orders) {
        List<DineInSummaryEntry> entries = new ArrayList<>();
        for (AggregatedOrder order : orders) {
            if (order.dineIn() > 0) {
                entries.add(new DineInSummaryEntry(order.name(), order.dineIn()));
            }
        }
        return entries;
    }

    public List<SummaryPage> build(List<AggregatedOrder> orders) {
        return paginate(entriesFrom(orders));
    }

    public List<SummaryPage> paginate(List<DineInSummaryEntry> entries) {
        if (entries.isEmpty()) {
            return List.of(new SummaryPage(TITLE, List.of(), false));
        }
        int perPage = bodyRowsPerPage();
        List<SummaryPage> pages = new ArrayList<>();
        for (int start = 0; start < entries.size(); start += perPage) {
            int end = Math.min(entries.size(), start + perPage);
            boolean continuation = start > 0;
            pages.add(new SummaryPage(continuation ? CONTINUED_TITLE : TITLE, entries.subList(start, end), continuation));
        }
        return pages;
    }

    /**
     * Distance from the page top to the top of the table (or the empty message baseline).
     */
    public float contentTopOffset() {
        return grid.marginY() + SUMMARY_TITLE_FONT_SIZE + TITLE_GAP;
    }

    public float[] columnWidths() {
        float available = grid.printableWidth();
        return new float[]{available * NAME_COLUMN_SHARE, available * (1f - NAME_COLUMN_SHARE)};
    }

    /**
     * Body rows that fit between the title and the bottom margin, never less than one.
     */
    int bodyRowsPerPage() {
        float available = grid.pageHeight() - contentTopOffset() - grid.marginY();
        int rows = (int) Math.floor(available / TABLE_STYLE.rowHeight()) - 1;
        return Math.max(1, rows);
    }

    public static List<List<String>> tableRows(SummaryPage page) {
        List<List<String>> rows = new ArrayList<>(page.entries().size() + 1);
        rows.add(HEADER);
        for (DineInSummaryEntry entry : page.entries()) {
            rows.add(List.of(entry.name(), String.valueOf(entry.count())));
        }
        return rows;
    }
}
