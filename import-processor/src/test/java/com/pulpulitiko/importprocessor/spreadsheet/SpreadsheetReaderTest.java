package com.pulpulitiko.importprocessor.spreadsheet;

import com.pulpulitiko.importprocessor.domain.ImportRow;
import com.pulpulitiko.importprocessor.domain.RawRow;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetFormatException.Reason;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static com.pulpulitiko.importprocessor.support.TestWorkbooks.headersWithout;
import static com.pulpulitiko.importprocessor.support.TestWorkbooks.row;
import static com.pulpulitiko.importprocessor.support.TestWorkbooks.xlsx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpreadsheetReaderTest {

    private final SpreadsheetReader reader = new SpreadsheetReader();
    private final ImportRowMapper mapper = new ImportRowMapper();

    @Test
    @DisplayName("Headers match regardless of case, padding and column order")
    void headers_areCaseAndSpaceInsensitive() throws Exception {
        byte[] file = xlsx(List.of("  PARTY ", "term START", "name", "Jurisdiction Name", "POSITION", "jurisdiction type"),
                row("PDP-Laban", "2022-06-30", "Michael Rama", "Cebu City", "Mayor", "City"));

        List<RawRow> rows = read(file);

        assertThat(rows).hasSize(1);
        ImportRow mapped = mapper.map(rows.get(0));
        assertThat(mapped.getName()).isEqualTo("Michael Rama");
        assertThat(mapped.getPosition()).isEqualTo("Mayor");
        assertThat(mapped.getJurisdictionType()).isEqualTo("city");
        assertThat(mapped.getParty()).isEqualTo("PDP-Laban");
        assertThat(mapped.getTermStart()).isEqualTo("2022-06-30");
        assertThat(mapped.getTermEnd()).isNull();
        assertThat(mapped.getRowNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("Rows with an empty first cell are skipped; row numbers keep the sheet position")
    void blankFirstCell_rowIsSkipped() throws Exception {
        byte[] file = xlsx(
                row("Gwendolyn Garcia", "Governor", "province", "Cebu", "One Cebu", "2019-06-30"),
                row("", "Mayor", "city", "Cebu City", "PDP-Laban", "2022-06-30"),
                row("   ", "Mayor", "city", "Cebu City", "PDP-Laban", "2022-06-30"),
                row("Michael Rama", "Mayor", "city", "Cebu City", "PDP-Laban", "2022-06-30"));

        List<RawRow> rows = read(file);

        assertThat(rows).extracting(RawRow::rowNumber).containsExactly(2, 5);
    }

    @Test
    @DisplayName("Cell values are trimmed and blank optional cells map to null")
    void values_areTrimmed() throws Exception {
        byte[] file = xlsx(row("  Michael Rama ", " Mayor", "city ", " Cebu City ", "PDP-Laban", " 2022-06-30 ", " ", "", "  "));

        ImportRow mapped = mapper.map(read(file).get(0));

        assertThat(mapped.getName()).isEqualTo("Michael Rama");
        assertThat(mapped.getJurisdictionName()).isEqualTo("Cebu City");
        assertThat(mapped.getTermStart()).isEqualTo("2022-06-30");
        assertThat(mapped.getTermEnd()).isNull();
        assertThat(mapped.getPhotoUrl()).isNull();
        assertThat(mapped.getShortBio()).isNull();
    }

    @Test
    @DisplayName("Date-formatted cells are read as YYYY-MM-DD")
    void dateCells_areReadAsIsoText() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("Politicians");
            Row header = sheet.createRow(0);
            List<String> headers = List.of("Name", "Position", "Jurisdiction Type", "Jurisdiction Name", "Party", "Term Start");
            for (int i = 0; i < headers.size(); i++) {
                header.createCell(i).setCellValue(headers.get(i));
            }
            CellStyle dateStyle = wb.createCellStyle();
            dateStyle.setDataFormat(wb.getCreationHelper().createDataFormat().getFormat("m/d/yy"));
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue("Michael Rama");
            data.createCell(1).setCellValue("Mayor");
            data.createCell(2).setCellValue("city");
            data.createCell(3).setCellValue("Cebu City");
            data.createCell(4).setCellValue("PDP-Laban");
            data.createCell(5).setCellValue(LocalDate.of(2022, 6, 30));
            data.getCell(5).setCellStyle(dateStyle);
            wb.write(out);
        }

        List<RawRow> rows = read(out.toByteArray());

        assertThat(rows.get(0).get(ImportColumns.TERM_START)).isEqualTo("2022-06-30");
    }

    @Test
    @DisplayName("Header row only: INSUFFICIENT_ROWS")
    void headerOnly_isInsufficientRows() {
        byte[] file = xlsx();

        assertThatThrownBy(() -> read(file))
                .isInstanceOf(SpreadsheetFormatException.class)
                .satisfies(e -> assertThat(((SpreadsheetFormatException) e).getReason()).isEqualTo(Reason.INSUFFICIENT_ROWS));
    }

    @Test
    @DisplayName("Missing required column is reported by name")
    void missingRequiredColumn() {
        byte[] file = xlsx(headersWithout("Party"),
                row("Michael Rama", "Mayor", "city", "Cebu City", "2022-06-30"));

        assertThatThrownBy(() -> read(file))
                .isInstanceOf(SpreadsheetFormatException.class)
                .hasMessage("Missing required column: party")
                .satisfies(e -> {
                    SpreadsheetFormatException sfe = (SpreadsheetFormatException) e;
                    assertThat(sfe.getReason()).isEqualTo(Reason.MISSING_COLUMN);
                    assertThat(sfe.getColumn()).isEqualTo("party");
                });
    }

    @Test
    @DisplayName("Optional columns may be absent")
    void optionalColumnsAbsent_isFine() throws Exception {
        byte[] file = xlsx(List.of("Name", "Position", "Jurisdiction Type", "Jurisdiction Name", "Party", "Term Start"),
                row("Michael Rama", "Mayor", "city", "Cebu City", "PDP-Laban", "2022-06-30"));

        ImportRow mapped = mapper.map(read(file).get(0));

        assertThat(mapped.getTermEnd()).isNull();
        assertThat(mapped.getBirthDate()).isNull();
    }

    @Test
    @DisplayName("Every data row blank in the first cell: NO_DATA_ROWS")
    void onlyBlankRows_isNoDataRows() {
        byte[] file = xlsx(row("", "Mayor"), row(" ", "Governor"));

        assertThatThrownBy(() -> read(file))
                .isInstanceOf(SpreadsheetFormatException.class)
                .hasMessage("No valid data rows found")
                .satisfies(e -> assertThat(((SpreadsheetFormatException) e).getReason()).isEqualTo(Reason.NO_DATA_ROWS));
    }

    @Test
    @DisplayName("Workbook without any sheet: NO_SHEETS")
    void sheetlessWorkbook_isNoSheets() throws Exception {
        byte[] file;
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            workbook.write(out);
            file = out.toByteArray();
        }

        assertThatThrownBy(() -> read(file))
                .isInstanceOf(SpreadsheetFormatException.class)
                .hasMessage("Spreadsheet has no sheets")
                .satisfies(e -> assertThat(((SpreadsheetFormatException) e).getReason()).isEqualTo(Reason.NO_SHEETS));
    }

    @Test
    @DisplayName("Bytes that are not a spreadsheet: MALFORMED_INPUT")
    void notASpreadsheet_isMalformed() {
        byte[] file = "name,position\nMichael Rama,Mayor\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> read(file))
                .isInstanceOf(SpreadsheetFormatException.class)
                .satisfies(e -> assertThat(((SpreadsheetFormatException) e).getReason()).isEqualTo(Reason.MALFORMED_INPUT));
    }

    // ─── helpers ─────────────────────────────────────────────────────────────

    private List<RawRow> read(byte[] file) throws SpreadsheetFormatException {
        return reader.read(new ByteArrayInputStream(file));
    }
}
