package com.pulpulitiko.importprocessor.report;

import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.domain.JurisdictionRef;
import com.pulpulitiko.importprocessor.domain.JurisdictionType;
import com.pulpulitiko.importprocessor.domain.OfficeholderAssignment;
import com.pulpulitiko.importprocessor.domain.RawRow;
import com.pulpulitiko.importprocessor.domain.ReconciliationAction;
import com.pulpulitiko.importprocessor.domain.ReconciliationOutcome;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import com.pulpulitiko.importprocessor.reconcile.ReconciliationEngine;
import com.pulpulitiko.importprocessor.spreadsheet.ImportColumns;
import com.pulpulitiko.importprocessor.spreadsheet.ImportRowMapper;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetReader;
import com.pulpulitiko.importprocessor.support.InMemoryOfficeholderRegistry;
import com.pulpulitiko.importprocessor.support.TestCatalogs;
import com.pulpulitiko.importprocessor.validation.ImportRowValidator;
import com.pulpulitiko.importprocessor.validation.ProximitySuggestionEngine;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryExportGeneratorTest {

    private final ReferenceCatalog catalog = TestCatalogs.catalog();
    private final RegistryExportGenerator generator = new RegistryExportGenerator();

    @Test
    @DisplayName("Ids are exported as catalog names in the import layout")
    void export_resolvesNames() throws Exception {
        byte[] bytes = generator.generate(List.of(
                assignment("Michael Rama", "pos-mayor", JurisdictionRef.of(JurisdictionType.CITY, "city-cebu"),
                        "party-pdp", LocalDate.of(2022, 6, 30), LocalDate.of(2025, 6, 30))), catalog);

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = wb.getSheet(RegistryExportGenerator.SHEET);
            Row header = sheet.getRow(0);
            for (int i = 0; i < ImportColumns.EXPORT_HEADERS.size(); i++) {
                assertThat(header.getCell(i).getStringCellValue()).isEqualTo(ImportColumns.EXPORT_HEADERS.get(i));
            }
            Row row = sheet.getRow(1);
            assertThat(row.getCell(0).getStringCellValue()).isEqualTo("Michael Rama");
            assertThat(row.getCell(1).getStringCellValue()).isEqualTo("Mayor");
            assertThat(row.getCell(2).getStringCellValue()).isEqualTo("city");
            assertThat(row.getCell(3).getStringCellValue()).isEqualTo("Cebu City");
            assertThat(row.getCell(4).getStringCellValue()).isEqualTo("PDP-Laban");
            assertThat(row.getCell(5).getStringCellValue()).isEqualTo("2022-06-30");
            assertThat(row.getCell(6).getStringCellValue()).isEqualTo("2025-06-30");
        }
    }

    @Test
    @DisplayName("A jurisdiction the directory no longer knows is exported as its id")
    void export_unknownJurisdiction_fallsBackToId() throws Exception {
        byte[] bytes = generator.generate(List.of(
                assignment("Abby Binay", "pos-mayor", JurisdictionRef.of(JurisdictionType.CITY, "city-gone"),
                        "party-np", LocalDate.of(2016, 6, 30), null)), catalog);

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertThat(wb.getSheet(RegistryExportGenerator.SHEET).getRow(1).getCell(3).getStringCellValue())
                    .isEqualTo("city-gone");
        }
    }

    @Test
    @DisplayName("Re-importing an unchanged export only yields UNCHANGED outcomes and no writes")
    void export_reimport_isIdempotent() throws Exception {
        InMemoryOfficeholderRegistry registry = new InMemoryOfficeholderRegistry();
        registry.seed(assignment("Ferdinand Marcos Jr.", "pos-president", JurisdictionRef.national(),
                "party-np", LocalDate.of(2022, 6, 30), LocalDate.of(2028, 6, 30)));
        registry.seed(assignment("Gwendolyn Garcia", "pos-governor", JurisdictionRef.of(JurisdictionType.PROVINCE, "prov-cebu"),
                "party-one-cebu", LocalDate.of(2019, 6, 30), null));
        OfficeholderAssignment mayor = assignment("Michael Rama", "pos-mayor",
                JurisdictionRef.of(JurisdictionType.CITY, "city-cebu"), "party-pdp", LocalDate.of(2022, 6, 30), null);
        mayor.setPhotoUrl("https://example.org/rama.jpg");
        mayor.setShortBio("Mayor of Cebu City");
        registry.seed(mayor);

        byte[] export = generator.generate(registry.listCurrent(), catalog);

        List<RawRow> rows = new SpreadsheetReader().read(new ByteArrayInputStream(export));
        ImportRowMapper mapper = new ImportRowMapper();
        ImportRowValidator validator = new ImportRowValidator(new ProximitySuggestionEngine(2), 3, true);
        List<ValidatedImportRow> validated = rows.stream()
                .map(mapper::map)
                .map(row -> validator.validate(row, catalog))
                .toList();

        assertThat(validated).allSatisfy(row -> assertThat(row.getErrors()).isEmpty());

        List<ReconciliationOutcome> outcomes = new ReconciliationEngine(registry).reconcileAll(validated);

        assertThat(outcomes).hasSize(3)
                .extracting(ReconciliationOutcome::action)
                .containsOnly(ReconciliationAction.UNCHANGED);
        assertThat(registry.writeCount()).isZero();
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private static OfficeholderAssignment assignment(String name, String positionId, JurisdictionRef jurisdiction,
                                                     String partyId, LocalDate termStart, LocalDate termEnd) {
        return OfficeholderAssignment.builder()
                .id(positionId + "-1")
                .politicianName(name)
                .positionId(positionId)
                .partyId(partyId)
                .jurisdiction(jurisdiction)
                .termStart(termStart)
                .termEnd(termEnd)
                .current(true)
                .build();
    }
}
