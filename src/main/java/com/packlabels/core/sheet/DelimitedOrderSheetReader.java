package com.packlabels.core.sheet;

import com.packlabels.logging.AppLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads comma or tab separated order exports.
 * <p>
 * The first non-blank line holds the headers. Fields may be wrapped in double quotes, with
 * {@code ""} standing for a literal quote; quoted fields may not span lines.
 */
public class DelimitedOrderSheetReader implements OrderSheetReader {
    private static final Logger LOGGER = AppLogger.get();
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    private final char separator;

    public DelimitedOrderSheetReader(char separator) {
        this.separator = separator;
    }

    public static DelimitedOrderSheetReader csv() {
        return new DelimitedOrderSheetReader(',');
    }

    public static DelimitedOrderSheetReader tabs() {
        return new DelimitedOrderSheetReader('\t');
    }

    @Override
    public OrderSheet read(InputStream in) throws IOException {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public OrderSheet read(Reader reader) throws IOException {
        try (BufferedReader buffered = new BufferedReader(reader)) {
            List<String> headers = null;
            List<Map<String, String>> rows = new ArrayList<>();
            String line;
            int lineNumber = 0;
            while ((line = buffered.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                if (headers == null) {
                    if (!line.isEmpty() && line.charAt(0) == BOM) {
                        line = line.substring(1);
                    }
                    headers = splitLine(line).stream().map(String::trim).toList();
                    continue;
                }
                List<String> values = splitLine(line);
                if (values.size() > headers.size()) {
                    int extra = values.size() - headers.size();
                    int current = lineNumber;
                    LOGGER.fine(() -> "Line %d has %d value(s) beyond the header; ignoring them".formatted(current, extra));
                }
                rows.add(OrderSheet.toRow(headers, values));
            }
            if (headers == null) {
                return new OrderSheet(List.of(), List.of());
            }
            return new OrderSheet(headers, rows);
        }
    }

    List<String> splitLine(String line) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        current.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(ch);
                }
            } else if (ch == QUOTE && current.toString().isBlank()) {
                current.setLength(0);
                quoted = true;
            } else if (ch == separator) {
                values.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        values.add(current.toString());
        return values;
    }
}
