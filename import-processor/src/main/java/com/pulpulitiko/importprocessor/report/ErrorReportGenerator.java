package com.pulpulitiko.importprocessor.report;

import com.pulpulitiko.importprocessor.domain.ImportRun;
import com.pulpulitiko.importprocessor.domain.ReconciliationError;
import com.pulpulitiko.importprocessor.domain.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds the downloadable error report of a finished import run.
 *
 * <h3>Sheet "Import Errors"</h3>
 * <pre>
 *  A1      IMPORT ERROR REPORT
 *  A2..A6  Filename / Import Date / Total Rows / Successful / Failed   (values in column B)
 *  row 8   Row | Field | Error | Value | Suggestions
 *  row 9+  one line per validation error, suggestions joined with ", "
 * </pre>
 *
 * <h3>Sheet "Reconciliation Failures"</h3>
 * Valid rows the registry did not apply: {@code Row | Position | Jurisdiction | Error}.
 */
@Slf4j
@Component
public class ErrorReportGenerator {

    public static final String ERRORS_SHEET = "Import Errors";
    public static final String RECONCILIATION_SHEET = "Reconciliation Failures";

    static final String TITLE = "IMPORT ERROR REPORT";
    static final int ERROR_HEADER_ROW = 7;

    private static final List<String> ERROR_HEADERS = List.of("Row", "Field", "Error", "Value", "Suggestions");
    private static final List<String> RECONCILIATION_HEADERS = List.of("Row", "Position", "Jurisdiction", "Error");
    private static final DateTimeFormatter IMPORT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public byte[] generate(ImportRun run) throws IOException {
        XSSFWorkbook wb = new XSSFWorkbook();
        CellStyle header = Workbooks.headerStyle(wb);

        Sheet sheet = wb.createSheet(ERRORS_SHEET);
        Row title = sheet.createRow(0);
        title.createCell(0).setCellValue(TITLE);
        title.getCell(0).setCellStyle(Workbooks.boldStyle(wb, (short) 14));

        summaryLine(sheet, 1, "Filename:", run.getFilename());
        summaryLine(sheet, 2, "Import Date:", run.getStartedAt() == null ? ""
                : IMPORT_DATE.format(run.getStartedAt().atZone(ZoneId.systemDefault())));
        summaryLine(sheet, 3, "Total Rows:", run.getTotalRows());
        summaryLine(sheet, 4, "Successful:", run.getSuccessfulImports());
        summaryLine(sheet, 5, "Failed:", run.getFailedImports());

        Workbooks.writeHeader(sheet, ERROR_HEADER_ROW, ERROR_HEADERS, header);
        int rowIndex = ERROR_HEADER_ROW + 1;
        for (ValidationError error : run.getValidationErrors()) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(error.row());
            row.createCell(1).setCellValue(error.field());
            row.createCell(2).setCellValue(error.message());
            row.createCell(3).setCellValue(error.value());
            if (!error.suggestions().isEmpty()) {
                row.createCell(4).setCellValue(String.join(", ", error.suggestions()));
            }
        }
        Workbooks.setColumnWidths(sheet, 14, 20, 60, 30, 40);

        Sheet failures = wb.createSheet(RECONCILIATION_SHEET);
        Workbooks.writeHeader(failures, 0, RECONCILIATION_HEADERS, header);
        rowIndex = 1;
        for (ReconciliationError error : run.getReconciliationErrors()) {
            Row row = failures.createRow(rowIndex++);
            row.createCell(0).setCellValue(error.row());
            Workbooks.setText(row, 1, error.position());
            row.createCell(2).setCellValue(jurisdiction(error));
            Workbooks.setText(row, 3, error.message());
        }
        Workbooks.setColumnWidths(failures, 8, 30, 35, 70);

        log.debug("Error report for run {}: {} validation errors, {} reconciliation failures",
                run.getId(), run.getValidationErrors().size(), run.getReconciliationErrors().size());
        return Workbooks.toBytes(wb);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private static void summaryLine(Sheet sheet, int rowIndex, String label, String value) {
        Row row = sheet.createRow(rowIndex);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value == null ? "" : value);
    }

    private static void summaryLine(Sheet sheet, int rowIndex, String label, int value) {
        Row row = sheet.createRow(rowIndex);
        row.createCell(0).setCellValue(label);
        row.createCell(1).setCellValue(value);
    }

    private static String jurisdiction(ReconciliationError error) {
        if (error.jurisdictionName() == null || error.jurisdictionName().isBlank()) {
            return error.jurisdictionType();
        }
        return "%s (%s)".formatted(error.jurisdictionName(), error.jurisdictionType());
    }
}
