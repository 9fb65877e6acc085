package com.pulpulitiko.importprocessor.spreadsheet;

import com.pulpulitiko.importprocessor.domain.RawRow;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetFormatException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the first sheet of an {@code .xlsx}/{@code .xls} document into {@link RawRow}s.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>Row 1 is the header. Headers are trimmed and lower-cased; column order does not matter.</li>
 *   <li>Every column in {@link ImportColumns#REQUIRED} must be present.</li>
 *   <li>Rows whose first cell is blank are skipped silently.</li>
 *   <li>Date-formatted cells read as {@code YYYY-MM-DD}; every other value is trimmed text.</li>
 * </ul>
 *
 * <p>No semantic validation happens here.
 */
@Slf4j
@Component
public class SpreadsheetReader {

    public List<RawRow> read(InputStream input) throws SpreadsheetFormatException {
        try (Workbook workbook = open(input)) {
            return readFirstSheet(workbook);
        } catch (IOException e) {
            throw new SpreadsheetFormatException(Reason.MALFORMED_INPUT,
                    "Could not read spreadsheet: " + e.getMessage(), e);
        }
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private Workbook open(InputStream input) throws IOException, SpreadsheetFormatException {
        try {
            return WorkbookFactory.create(input);
        } catch (EncryptedDocumentException e) {
            throw new SpreadsheetFormatException(Reason.MALFORMED_INPUT, "Spreadsheet is password protected", e);
        } catch (IllegalArgumentException e) {
            // POI signals empty and non-spreadsheet input this way
            throw new SpreadsheetFormatException(Reason.MALFORMED_INPUT,
                    "Not a spreadsheet: " + e.getMessage(), e);
        }
    }

    private List<RawRow> readFirstSheet(Workbook workbook) throws SpreadsheetFormatException {
        if (workbook.getNumberOfSheets() == 0) {
            throw new SpreadsheetFormatException(Reason.NO_SHEETS, "Spreadsheet has no sheets");
        }
        Sheet sheet = workbook.getSheetAt(0);
        if (sheet.getPhysicalNumberOfRows() < 2) {
            throw new SpreadsheetFormatException(Reason.INSUFFICIENT_ROWS,
                    "File must have at least a header row and one data row");
        }

        DataFormatter formatter = new DataFormatter(Locale.ROOT);
        Map<String, Integer> columns = headerColumns(sheet.getRow(0), formatter);
        for (String required : ImportColumns.REQUIRED) {
            if (!columns.containsKey(required)) {
                throw SpreadsheetFormatException.missingColumn(required);
            }
        }

        List<RawRow> rows = new ArrayList<>();
        for (int i = 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (row == null || cellText(row.getCell(0), formatter).isEmpty()) {
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            columns.forEach((header, index) -> values.put(header, cellText(row.getCell(index), formatter)));
            rows.add(new RawRow(i + 1, values));
        }

        if (rows.isEmpty()) {
            throw new SpreadsheetFormatException(Reason.NO_DATA_ROWS, "No valid data rows found");
        }
        log.debug("Read {} data rows from sheet '{}'", rows.size(), sheet.getSheetName());
        return rows;
    }

    private Map<String, Integer> headerColumns(Row header, DataFormatter formatter) {
        Map<String, Integer> columns = new LinkedHashMap<>();
        if (header == null) {
            return columns;
        }
        for (Cell cell : header) {
            String name = cellText(cell, formatter).toLowerCase(Locale.ROOT);
            if (!name.isEmpty()) {
                columns.putIfAbsent(name, cell.getColumnIndex());
            }
        }
        return columns;
    }

    private String cellText(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        String text = switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue().toLocalDate().toString()
                    : cell.getCellType() == CellType.FORMULA
                            ? NumberToTextConverter.toText(cell.getNumericCellValue())
                            : formatter.formatCellValue(cell);
            case STRING -> cell.getStringCellValue();
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> "";
        };
        return text.trim();
    }
}
