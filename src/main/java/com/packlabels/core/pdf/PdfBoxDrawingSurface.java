package com.packlabels.core.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.awt.Color;
import java.io.IOException;
import java.io.OutputStream;
import java.text.Normalizer;
import java.util.List;

/**
 * {@link DrawingSurface} backed by an in-memory PDFBox document using the standard Helvetica faces.
 * <p>
 * Characters the WinAnsi encoding cannot show are replaced by their unaccented base letter when
 * one exists, otherwise by {@code ?}. Table cells that are too wide are cut with an ellipsis.
 */
public class PdfBoxDrawingSurface implements DrawingSurface {

    private static final String ELLIPSIS = "...";

    private final PDDocument document;
    private final PDRectangle pageSize;
    private PDPageContentStream stream;

    public PdfBoxDrawingSurface(float pageWidth, float pageHeight) {
        if (pageWidth <= 0 || pageHeight <= 0) {
            throw new IllegalArgumentException("Page size must be positive");
        }
        this.document = new PDDocument();
        this.pageSize = new PDRectangle(pageWidth, pageHeight);
    }

    @Override
    public float pageWidth() {
        return pageSize.getWidth();
    }

    @Override
    public float pageHeight() {
        return pageSize.getHeight();
    }

    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public void beginPage() throws IOException {
        if (stream != null) {
            throw new IllegalStateException("Previous page is still open");
        }
        PDPage page = new PDPage(pageSize);
        document.addPage(page);
        stream = new PDPageContentStream(document, page);
    }

    @Override
    public void endPage() throws IOException {
        requireOpenPage().close();
        stream = null;
    }

    @Override
    public void drawText(String text, float x, float baseline, SheetFont font, float size, TextAlign align) throws IOException {
        PDPageContentStream content = requireOpenPage();
        PDFont pdFont = pdFont(font);
        String printable = printable(pdFont, text);
        if (printable.isEmpty()) {
            return;
        }
        float width = textWidth(pdFont, printable, size);
        float startX = switch (align) {
            case LEFT -> x;
            case CENTER -> x - width / 2f;
            case RIGHT -> x - width;
        };
        content.beginText();
        content.setFont(pdFont, size);
        content.newLineAtOffset(startX, baseline);
        content.showText(printable);
        content.endText();
    }

    @Override
    public float drawTable(List<List<String>> rows, float x, float top, float[] columnWidths, TableStyle style) throws IOException {
        PDPageContentStream content = requireOpenPage();
        if (rows.isEmpty()) {
            return 0f;
        }
        float rowHeight = style.rowHeight();
        float tableWidth = 0f;
        for (float width : columnWidths) {
            tableWidth += width;
        }
        float tableHeight = rowHeight * rows.size();

        for (int r = 0; r < rows.size(); r++) {
            Color background = r == 0 ? style.headerBackground() : style.bodyBackground(r - 1);
            if (background != null) {
                content.setNonStrokingColor(background);
                content.addRect(x, top - (r + 1) * rowHeight, tableWidth, rowHeight);
                content.fill();
            }
        }

        content.setNonStrokingColor(Color.BLACK);
        for (int r = 0; r < rows.size(); r++) {
            List<String> cells = rows.get(r);
            PDFont pdFont = pdFont(r == 0 ? style.headerFont() : style.bodyFont());
            float baseline = top - (r + 1) * rowHeight + style.paddingY() + style.fontSize() * 0.3f;
            float cellX = x;
            for (int c = 0; c < columnWidths.length; c++) {
                String value = c < cells.size() && cells.get(c) != null ? cells.get(c) : "";
                float available = columnWidths[c] - 2 * style.paddingX();
                String fitted = fit(pdFont, printable(pdFont, value), style.fontSize(), available);
                if (!fitted.isEmpty()) {
                    float width = textWidth(pdFont, fitted, style.fontSize());
                    float textX = style.isCentered(c)
                        ? cellX + (columnWidths[c] - width) / 2f
                        : cellX + style.paddingX();
                    content.beginText();
                    content.setFont(pdFont, style.fontSize());
                    content.newLineAtOffset(textX, baseline);
                    content.showText(fitted);
                    content.endText();
                }
                cellX += columnWidths[c];
            }
        }

        content.setStrokingColor(style.borderColor());
        if (style.gridLineWidth() > 0) {
            content.setLineWidth(style.gridLineWidth());
            float lineX = x;
            for (int c = 0; c < columnWidths.length - 1; c++) {
                lineX += columnWidths[c];
                content.moveTo(lineX, top);
                content.lineTo(lineX, top - tableHeight);
            }
            for (int r = 1; r < rows.size(); r++) {
                float lineY = top - r * rowHeight;
                content.moveTo(x, lineY);
                content.lineTo(x + tableWidth, lineY);
            }
            content.stroke();
        }
        if (style.boxLineWidth() > 0) {
            content.setLineWidth(style.boxLineWidth());
            content.addRect(x, top - tableHeight, tableWidth, tableHeight);
            content.stroke();
        }
        content.setStrokingColor(Color.BLACK);
        return tableHeight;
    }

    @Override
    public void save(OutputStream out) throws IOException {
        if (stream != null) {
            throw new IllegalStateException("Cannot save while a page is open");
        }
        document.save(out);
    }

    @Override
    public void close() throws IOException {
        try {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        } finally {
            document.close();
        }
    }

    private PDPageContentStream requireOpenPage() {
        if (stream == null) {
            throw new IllegalStateException("No page is open; call beginPage() first");
        }
        return stream;
    }

    private static PDFont pdFont(SheetFont font) {
        return font == SheetFont.BOLD ? PDType1Font.HELVETICA_BOLD : PDType1Font.HELVETICA;
    }

    static float textWidth(PDFont font, String text, float size) throws IOException {
        return font.getStringWidth(text) / 1000f * size;
    }

    private static String fit(PDFont font, String text, float size, float maxWidth) throws IOException {
        if (text.isEmpty() || textWidth(font, text, size) <= maxWidth) {
            return text;
        }
        String cut = text;
        while (!cut.isEmpty() && textWidth(font, cut + ELLIPSIS, size) > maxWidth) {
            cut = cut.substring(0, cut.length() - 1);
        }
        return cut.isEmpty() ? "" : cut.stripTrailing() + ELLIPSIS;
    }

    static String printable(PDFont font, String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            if (Character.isWhitespace(codePoint) || Character.isISOControl(codePoint)) {
                out.append(' ');
                return;
            }
            String glyph = new String(Character.toChars(codePoint));
            if (canEncode(font, glyph)) {
                out.append(glyph);
                return;
            }
            String base = Normalizer.normalize(glyph, Normalizer.Form.NFD)
                .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
            out.append(!base.isEmpty() && canEncode(font, base) ? base : "?");
        });
        return out.toString();
    }

    private static boolean canEncode(PDFont font, String glyph) {
        try {
            font.encode(glyph);
            return true;
        } catch (IllegalArgumentException | IOException ex) {
            return false;
        }
    }
}
