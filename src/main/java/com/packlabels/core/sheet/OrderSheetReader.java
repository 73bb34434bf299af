package com.packlabels.core.sheet;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an order file into headers and raw string rows.
 */
public interface OrderSheetReader {

    OrderSheet read(InputStream in) throws IOException;

    default OrderSheet read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }
}
