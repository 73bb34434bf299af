package com.packlabels.core.document;

import com.packlabels.core.label.LabelCardSequencer;
import com.packlabels.core.label.LabelSequence;
import com.packlabels.core.layout.GridLayoutEngine;
import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.layout.LabelPage;
import com.packlabels.core.order.AggregatedOrder;
import com.packlabels.core.order.CanonicalOrderRow;
import com.packlabels.core.order.ColumnAliasTable;
import com.packlabels.core.order.OrderAggregator;
import com.packlabels.core.order.SchemaNormalizer;
import com.packlabels.core.summary.DineInSummaryEntry;
import com.packlabels.core.summary.SummaryPage;
import com.packlabels.core.summary.SummaryTableBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw sheet rows into a {@link LabelDocument}.
 * <p>
 * Headers are normalized first, so a sheet with missing columns fails before any aggregation and
 * no partial document is produced. The assembler holds no state between calls.
 */
public class LabelDocumentAssembler {

    private final SchemaNormalizer normalizer;
    private final OrderAggregator aggregator = new OrderAggregator();
    private final LabelCardSequencer sequencer;

    public LabelDocumentAssembler() {
        this(ColumnAliasTable.defaults());
    }

    public LabelDocumentAssembler(ColumnAliasTable aliases) {
        this(aliases, LabelCardSequencer.DEFAULT_MAX_LABELS);
    }

    /**
     * @param maxLabels ceiling on the number of label cards, pack summary included
     */
    public LabelDocumentAssembler(ColumnAliasTable aliases, int maxLabels) {
        this.normalizer = new SchemaNormalizer(aliases);
        this.sequencer = new LabelCardSequencer(maxLabels);
    }

    /**
     * @param headers sheet headers in column order
     * @param rows    raw rows keyed by those headers
     * @param grid    label sheet geometry
     * @throws com.packlabels.core.order.OrderSchemaException when a canonical column is missing
     * @throws com.packlabels.core.label.LabelLimitException when the orders need too many labels
     */
    public LabelDocument assemble(Collection<String> headers, List<Map<String, String>> rows, LabelGrid grid) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(grid, "grid");
        List<CanonicalOrderRow> canonical = normalizer.normalize(headers, rows);
        List<AggregatedOrder> orders = aggregator.aggregate(canonical);

        LabelSequence labels = sequencer.sequence(orders);
        List<LabelPage> labelPages = new GridLayoutEngine(grid).layout(labels.cards());

        List<DineInSummaryEntry> entries = SummaryTableBuilder.entriesFrom(orders);
        List<SummaryPage> summaryPages = new SummaryTableBuilder(grid).paginate(entries);

        List<DocumentPage> pages = new ArrayList<>(labelPages.size() + summaryPages.size());
        pages.addAll(labelPages);
        pages.addAll(summaryPages);
        return new LabelDocument(grid, orders, labels, entries, pages);
    }
}
