package com.packlabels.core.document;

import com.packlabels.core.layout.LabelGrid;
import com.packlabels.core.order.ColumnAliasTable;
import com.packlabels.core.pdf.PdfBoxDrawingSurface;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw rows in, PDF bytes out.
 */
public class LabelSheetGenerator {

    private final LabelDocumentAssembler assembler;
    private final LabelDocumentRenderer renderer = new LabelDocumentRenderer();
    private final LabelGrid grid;

    public LabelSheetGenerator() {
        this(LabelGrid.LETTER_30_UP, ColumnAliasTable.defaults());
    }

    public LabelSheetGenerator(LabelGrid grid, ColumnAliasTable aliases) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.assembler = new LabelDocumentAssembler(aliases);
    }

    /**
     * Builds the document and writes it as PDF to {@code out}. Nothing is written when the rows do
     * not resolve to the canonical columns.
     *
     * @return the page model that was written
     */
    public LabelDocument generate(Collection<String> headers,
                                  List<Map<String, String>> rows,
                                  OutputStream out) throws IOException {
        LabelDocument document = assembler.assemble(headers, rows, grid);
        write(document, out);
        return document;
    }

    public void write(LabelDocument document, OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        try (PdfBoxDrawingSurface surface = new PdfBoxDrawingSurface(document.grid().pageWidth(), document.grid().pageHeight())) {
            renderer.render(document, surface);
            surface.save(out);
        }
    }
}
