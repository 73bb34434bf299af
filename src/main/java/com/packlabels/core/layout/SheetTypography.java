package com.packlabels.core.layout;

/**
 * Font sizes and padding shared by the label and summary pages.
 */
public final class SheetTypography {
    public static final float TITLE_FONT_SIZE = 12f;
    public static final float BODY_FONT_SIZE = 10f;
    public static final float COUNT_FONT_SIZE = 12f;
    public static final float SUMMARY_TITLE_FONT_SIZE = 18f;
    public static final float SUMMARY_BODY_FONT_SIZE = 11f;
    public static final float CONTENT_PADDING = LabelGrid.inches(0.2f);

    private SheetTypography() {
    }
}
