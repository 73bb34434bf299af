package com.packlabels.core.sheet;

import com.packlabels.logging.AppLogger;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.util.RecordFormatException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads the first worksheet of an {@code .xls} or {@code .xlsx} workbook.
 * <p>
 * The first non-blank row is the header. Numeric cells are read as their stored value, so a
 * quantity of 2.6 shown as "3" still reads as 2.6; other cells are read as the text Excel would
 * display. Formulas are evaluated and fully blank rows are skipped. Any failure to parse the
 * workbook surfaces as an {@link IOException}.
 */
public class ExcelOrderSheetReader implements OrderSheetReader {
    private static final Logger LOGGER = AppLogger.get();

    @Override
    public OrderSheet read(InputStream in) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return new OrderSheet(List.of(), List.of());
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter fmt = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            List<String> headers = null;
            int headerWidth = 0;
            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                if (headers == null) {
                    List<String> candidate = readCells(row, fmt, evaluator, Math.max(row.getLastCellNum(), 0));
                    if (isBlank(candidate)) {
                        continue;
                    }
                    headers = candidate;
                    headerWidth = candidate.size();
                    continue;
                }
                List<String> values = readCells(row, fmt, evaluator, headerWidth);
                if (isBlank(values)) {
                    continue;
                }
                rows.add(OrderSheet.toRow(headers, values));
            }

            if (headers == null) {
                return new OrderSheet(List.of(), List.of());
            }
            LOGGER.fine("Read %d row(s) from worksheet '%s'".formatted(rows.size(), sheet.getSheetName()));
            return new OrderSheet(headers, rows);
        } catch (EncryptedDocumentException | POIXMLException | RecordFormatException | IllegalArgumentException ex) {
            throw new IOException("Could not read order sheet: " + ex.getMessage(), ex);
        }
    }

    private static List<String> readCells(Row row, DataFormatter fmt, FormulaEvaluator evaluator, int width) {
        List<String> values = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Cell cell = row.getCell(c);
            values.add(cell == null ? "" : cellText(cell, fmt, evaluator));
        }
        return values;
    }

    private static String cellText(Cell cell, DataFormatter fmt, FormulaEvaluator evaluator) {
        CellType type = cell.getCellType() == CellType.FORMULA
            ? evaluator.evaluateFormulaCell(cell)
            : cell.getCellType();
        if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
            return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
        }
        return fmt.formatCellValue(cell, evaluator).trim();
    }

    private static boolean isBlank(List<String> values) {
        return values.stream().allMatch(String::isEmpty);
    }
}
