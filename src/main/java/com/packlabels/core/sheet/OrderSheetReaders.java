package com.packlabels.core.sheet;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Picks the reader for an order file from its extension.
 */
public final class OrderSheetReaders {

    public static final List<String> SUPPORTED_EXTENSIONS = List.of("xls", "xlsx", "csv", "tsv", "txt");

    private OrderSheetReaders() {
    }

    public static OrderSheetReader forFile(Path file) throws UnsupportedSheetException {
        String extension = extension(file);
        return switch (extension) {
            case "xls", "xlsx" -> new ExcelOrderSheetReader();
            case "csv" -> DelimitedOrderSheetReader.csv();
            case "tsv", "txt" -> DelimitedOrderSheetReader.tabs();
            default -> throw new UnsupportedSheetException(
                "File type not supported. Upload one of: " + String.join(", ", SUPPORTED_EXTENSIONS));
        };
    }

    public static boolean isSupported(Path file) {
        return SUPPORTED_EXTENSIONS.contains(extension(file));
    }

    static String extension(Path file) {
        Path name = file == null ? null : file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
