package com.packlabels.core.layout;

import com.packlabels.core.document.DocumentPage;

import java.util.List;

/**
 * One sheet of label cells; holds at most {@link LabelGrid#cellsPerPage()} cards.
 */
public record LabelPage(int pageIndex, List<PlacedLabel> labels) implements DocumentPage {

    public LabelPage {
        labels = List.copyOf(labels);
    }
}
