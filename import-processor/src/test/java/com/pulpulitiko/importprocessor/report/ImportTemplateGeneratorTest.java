package com.pulpulitiko.importprocessor.report;

import com.pulpulitiko.importprocessor.spreadsheet.ImportColumns;
import com.pulpulitiko.importprocessor.support.TestCatalogs;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ImportTemplateGeneratorTest {

    @Test
    @DisplayName("Template carries the header row, dropdowns and the reference sheets")
    void template_layout() throws Exception {
        byte[] bytes = new ImportTemplateGenerator().generate(TestCatalogs.catalog());

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertThat(wb.getSheetAt(0).getSheetName()).isEqualTo(ImportTemplateGenerator.SHEET);

            Sheet sheet = wb.getSheet(ImportTemplateGenerator.SHEET);
            for (int i = 0; i < ImportColumns.TEMPLATE_HEADERS.size(); i++) {
                assertThat(sheet.getRow(0).getCell(i).getStringCellValue())
                        .isEqualTo(ImportColumns.TEMPLATE_HEADERS.get(i));
            }
            assertThat(sheet.getLastRowNum()).isZero();
            assertThat(sheet.getDataValidations()).hasSize(3);

            Sheet positions = wb.getSheet(ImportTemplateGenerator.POSITIONS_SHEET);
            assertThat(positions.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Position Name");
            assertThat(positions.getLastRowNum()).isEqualTo(TestCatalogs.POSITIONS.size());
            assertThat(positions.getRow(3).getCell(0).getStringCellValue()).isEqualTo("Governor");

            Sheet parties = wb.getSheet(ImportTemplateGenerator.PARTIES_SHEET);
            assertThat(parties.getLastRowNum()).isEqualTo(TestCatalogs.PARTIES.size());

            Sheet instructions = wb.getSheet(ImportTemplateGenerator.INSTRUCTIONS_SHEET);
            assertThat(instructions.getRow(0).getCell(0).getStringCellValue())
                    .isEqualTo(ImportTemplateGenerator.INSTRUCTIONS.get(0));
        }
    }
}
