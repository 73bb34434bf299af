package com.packlabels.cli;

import com.packlabels.core.label.PackSplit;

import java.nio.file.Path;

/**
 * Outcome of one {@link LabelSheetJob} run.
 *
 * @param manifest path of the JSON manifest, or {@code null} when none was written
 */
public record LabelSheetResult(Path output,
                               int labelPages,
                               int labelCards,
                               PackSplit packTotals,
                               int dineInEntries,
                               Path manifest) {

    public String describe() {
        return "%s: %d label card(s) on %d page(s), %d double(s), %d single(s), %d dine-in name(s)".formatted(
            output.getFileName(), labelCards, labelPages, packTotals.doubles(), packTotals.singles(), dineInEntries);
    }
}
