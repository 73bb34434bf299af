package com.packlabels.core.pdf;

/**
 * Fonts used on the sheet. The PDF surface maps them to the standard Helvetica faces.
 */
public enum SheetFont {
    REGULAR,
    BOLD
}
