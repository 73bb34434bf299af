package com.packlabels.core.pdf;

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory {@link DrawingSurface} that records every call for assertions.
 */
public class RecordingDrawingSurface implements DrawingSurface {

    public record TextCall(int page, String text, float x, float baseline, SheetFont font, float size, TextAlign align) {
    }

    public record TableCall(int page, List<List<String>> rows, float x, float top, float[] columnWidths, TableStyle style) {
    }

    private final float pageWidth;
    private final float pageHeight;
    private final List<TextCall> texts = new ArrayList<>();
    private final List<TableCall> tables = new ArrayList<>();
    private int pages;
    private boolean open;

    public RecordingDrawingSurface(float pageWidth, float pageHeight) {
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
    }

    @Override
    public float pageWidth() {
        return pageWidth;
    }

    @Override
    public float pageHeight() {
        return pageHeight;
    }

    @Override
    public void beginPage() {
        if (open) {
            throw new IllegalStateException("page already open");
        }
        open = true;
        pages++;
    }

    @Override
    public void endPage() {
        if (!open) {
            throw new IllegalStateException("no page open");
        }
        open = false;
    }

    @Override
    public void drawText(String text, float x, float baseline, SheetFont font, float size, TextAlign align) {
        requireOpen();
        texts.add(new TextCall(pages - 1, text, x, baseline, font, size, align));
    }

    @Override
    public float drawTable(List<List<String>> rows, float x, float top, float[] columnWidths, TableStyle style) {
        requireOpen();
        tables.add(new TableCall(pages - 1, List.copyOf(rows), x, top, columnWidths.clone(), style));
        return rows.size() * style.rowHeight();
    }

    @Override
    public void save(OutputStream out) {
        if (open) {
            throw new IllegalStateException("page still open");
        }
    }

    @Override
    public void close() {
    }

    public int pageCount() {
        return pages;
    }

    public boolean isPageOpen() {
        return open;
    }

    public List<TextCall> texts() {
        return texts;
    }

    public List<TableCall> tables() {
        return tables;
    }

    public List<String> textsOnPage(int page) {
        return texts.stream()
            .filter(call -> call.page() == page)
            .map(TextCall::text)
            .collect(Collectors.toList());
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("draw outside a page");
        }
    }
}
