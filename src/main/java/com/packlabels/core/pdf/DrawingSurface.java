package com.packlabels.core.pdf;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Page-oriented drawing target used by the label and summary renderers.
 * <p>
 * Coordinates are in points with the origin at the bottom-left corner of the page; text y values
 * are baselines. Drawing is only valid between {@link #beginPage()} and {@link #endPage()}.
 */
public interface DrawingSurface extends Closeable {

    float pageWidth();

    float pageHeight();

    void beginPage() throws IOException;

    void endPage() throws IOException;

    void drawText(String text, float x, float baseline, SheetFont font, float size, TextAlign align) throws IOException;

    /**
     * Draws a table whose top-left corner is at {@code (x, top)}. The first row is the header.
     *
     * @return height of the drawn table
     */
    float drawTable(List<List<String>> rows, float x, float top, float[] columnWidths, TableStyle style) throws IOException;

    /**
     * Serializes every finished page.
     */
    void save(OutputStream out) throws IOException;
}
