package com.packlabels.core.sheet;

import java.io.IOException;

/**
 * The file cannot be used as an order sheet: wrong type or too large.
 */
public class UnsupportedSheetException extends IOException {

    public UnsupportedSheetException(String message) {
        super(message);
    }
}
