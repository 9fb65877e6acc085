package com.pulpulitiko.importprocessor.report;

import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import com.pulpulitiko.importprocessor.spreadsheet.ImportColumns;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.DataValidation;
import org.apache.poi.ss.usermodel.DataValidationConstraint;
import org.apache.poi.ss.usermodel.DataValidationHelper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddressList;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Blank import workbook: the {@code Politicians} sheet with the header row and dropdowns, the
 * {@code Valid Positions} and {@code Valid Parties} reference sheets the dropdowns read from,
 * and an {@code Instructions} sheet.
 */
@Slf4j
@Component
public class ImportTemplateGenerator {

    public static final String SHEET = "Politicians";
    public static final String POSITIONS_SHEET = "Valid Positions";
    public static final String PARTIES_SHEET = "Valid Parties";
    public static final String INSTRUCTIONS_SHEET = "Instructions";

    private static final int LAST_DATA_ROW = 999;
    private static final int POSITION_COLUMN = 1;
    private static final int JURISDICTION_TYPE_COLUMN = 2;
    private static final int PARTY_COLUMN = 4;

    static final List<String> INSTRUCTIONS = List.of(
            "OFFICEHOLDER IMPORT TEMPLATE - INSTRUCTIONS",
            "",
            "Required columns:",
            "  Name: full name of the politician, e.g. Juan Dela Cruz",
            "  Position: exactly as listed on the 'Valid Positions' sheet, e.g. Mayor",
            "  Jurisdiction Type: national, region, province, city, barangay or district",
            "  Jurisdiction Name: e.g. Makati City; leave blank for national positions",
            "  Party: exactly as listed on the 'Valid Parties' sheet",
            "  Term Start: date as YYYY-MM-DD, e.g. 2022-06-30",
            "",
            "Optional columns:",
            "  Term End: date as YYYY-MM-DD, not before Term Start",
            "  Photo URL, Short Bio",
            "  Birth Date: date as YYYY-MM-DD, tells apart politicians with the same name",
            "",
            "Notes:",
            "  1. Do not change the header row (row 1). Rows with an empty Name cell are skipped.",
            "  2. Only one politician holds a position in a jurisdiction at a time.",
            "  3. Importing the current holder again updates their term, party, photo and bio in place.",
            "  4. Importing a different politician archives the current holder and makes the new one current.",
            "  5. Rows with errors are not imported; download the error report to see why.");

    public byte[] generate(ReferenceCatalog catalog) throws IOException {
        XSSFWorkbook wb = new XSSFWorkbook();

        Sheet sheet = wb.createSheet(SHEET);
        Workbooks.writeHeader(sheet, 0, ImportColumns.TEMPLATE_HEADERS, Workbooks.headerStyle(wb));
        Workbooks.setColumnWidths(sheet, 25, 25, 20, 25, 25, 15, 15, 40, 50, 15);

        List<String> positions = catalog.positionNames();
        List<String> parties = catalog.partyNames();
        referenceSheet(wb, POSITIONS_SHEET, "Position Name", positions);
        referenceSheet(wb, PARTIES_SHEET, "Party Name", parties);

        DataValidationHelper helper = sheet.getDataValidationHelper();
        addDropdown(sheet, helper, JURISDICTION_TYPE_COLUMN,
                helper.createExplicitListConstraint(JurisdictionType.wireValues().toArray(String[]::new)));
        if (!positions.isEmpty()) {
            addDropdown(sheet, helper, POSITION_COLUMN,
                    helper.createFormulaListConstraint(rangeOf(POSITIONS_SHEET, positions.size())));
        }
        if (!parties.isEmpty()) {
            addDropdown(sheet, helper, PARTY_COLUMN,
                    helper.createFormulaListConstraint(rangeOf(PARTIES_SHEET, parties.size())));
        }

        Sheet instructions = wb.createSheet(INSTRUCTIONS_SHEET);
        for (int i = 0; i < INSTRUCTIONS.size(); i++) {
            instructions.createRow(i).createCell(0).setCellValue(INSTRUCTIONS.get(i));
        }
        instructions.getRow(0).getCell(0).setCellStyle(Workbooks.boldStyle(wb, (short) 14));
        instructions.setColumnWidth(0, 100 * 256);

        wb.setActiveSheet(0);
        log.debug("Import template generated with {} positions and {} parties", positions.size(), parties.size());
        return Workbooks.toBytes(wb);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private static void referenceSheet(XSSFWorkbook wb, String name, String header, List<String> values) {
        Sheet sheet = wb.createSheet(name);
        Workbooks.writeHeader(sheet, 0, List.of(header), Workbooks.headerStyle(wb));
        for (int i = 0; i < values.size(); i++) {
            Row row = sheet.createRow(i + 1);
            row.createCell(0).setCellValue(values.get(i));
        }
        sheet.setColumnWidth(0, 40 * 256);
    }

    private static void addDropdown(Sheet sheet, DataValidationHelper helper, int column,
                                    DataValidationConstraint constraint) {
        CellRangeAddressList cells = new CellRangeAddressList(1, LAST_DATA_ROW, column, column);
        DataValidation validation = helper.createValidation(constraint, cells);
        validation.setShowErrorBox(true);
        sheet.addValidationData(validation);
    }

    private static String rangeOf(String sheetName, int count) {
        return "'%s'!$A$2:$A$%d".formatted(sheetName, count + 1);
    }
}
