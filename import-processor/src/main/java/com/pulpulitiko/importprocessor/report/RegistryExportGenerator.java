package com.pulpulitiko.importprocessor.report;

import com.pulpulitiko.importprocessor.catalog.JurisdictionNotFoundException;
import com.pulpulitiko.importprocessor.catalog.Party;
import com.pulpulitiko.importprocessor.catalog.Position;
import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.domain.OfficeholderAssignment;
import com.pulpulitiko.importprocessor.spreadsheet.ImportColumns;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Writes current officeholders in the import layout, so an unchanged export can be uploaded
 * again and reconciles to nothing but {@code UNCHANGED} outcomes.
 *
 * <p>Ids are turned back into catalog names; dates are ISO {@code YYYY-MM-DD} text.
 */
@Slf4j
@Component
public class RegistryExportGenerator {

    public static final String SHEET = "Politicians";

    public byte[] generate(List<OfficeholderAssignment> assignments, ReferenceCatalog catalog) throws IOException {
        XSSFWorkbook wb = new XSSFWorkbook();
        Sheet sheet = wb.createSheet(SHEET);
        Workbooks.writeHeader(sheet, 0, ImportColumns.EXPORT_HEADERS, Workbooks.headerStyle(wb));

        int rowIndex = 1;
        for (OfficeholderAssignment assignment : assignments) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(assignment.getPoliticianName());
            row.createCell(1).setCellValue(catalog.positionById(assignment.getPositionId())
                    .map(Position::name)
                    .orElse(assignment.getPositionId()));
            row.createCell(2).setCellValue(assignment.getJurisdiction().type().wireValue());
            Workbooks.setText(row, 3, jurisdictionName(assignment, catalog));
            Workbooks.setText(row, 4, assignment.getPartyId() == null ? null
                    : catalog.partyById(assignment.getPartyId()).map(Party::name).orElse(assignment.getPartyId()));
            Workbooks.setText(row, 5, iso(assignment.getTermStart()));
            Workbooks.setText(row, 6, iso(assignment.getTermEnd()));
            Workbooks.setText(row, 7, assignment.getPhotoUrl());
            Workbooks.setText(row, 8, assignment.getShortBio());
        }
        Workbooks.setColumnWidths(sheet, 25, 25, 20, 25, 25, 15, 15, 40, 50);

        log.info("Registry export written with {} current assignments", assignments.size());
        return Workbooks.toBytes(wb);
    }

    private static String jurisdictionName(OfficeholderAssignment assignment, ReferenceCatalog catalog) {
        if (assignment.getJurisdiction().isNational()) {
            return null;
        }
        try {
            return catalog.jurisdictionName(assignment.getJurisdiction());
        } catch (JurisdictionNotFoundException e) {
            log.warn("Assignment {} refers to unknown {} '{}', exporting the id",
                    assignment.getId(), e.getType().wireValue(), e.getName());
            return assignment.getJurisdiction().id();
        }
    }

    private static String iso(LocalDate date) {
        return date == null ? null : date.toString();
    }
}
