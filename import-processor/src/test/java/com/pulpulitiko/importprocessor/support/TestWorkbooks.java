package com.pulpulitiko.importprocessor.support;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds small .xlsx fixtures in memory.
 */
public final class TestWorkbooks {

    public static final List<String> HEADERS = List.of(
            "Name", "Position", "Jurisdiction Type", "Jurisdiction Name", "Party",
            "Term Start", "Term End", "Photo URL", "Short Bio");

    private TestWorkbooks() {
    }

    public static String[] row(String... cells) {
        return cells;
    }

    public static byte[] xlsx(List<String> headers, String[]... rows) {
        try (XSSFWorkbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet("Politicians");
            Row header = sheet.createRow(0);
            for (int i = 0; i < headers.size(); i++) {
                header.createCell(i).setCellValue(headers.get(i));
            }
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r + 1);
                for (int c = 0; c < rows[r].length; c++) {
                    if (rows[r][c] != null) {
                        row.createCell(c).setCellValue(rows[r][c]);
                    }
                }
            }
            wb.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] xlsx(String[]... rows) {
        return xlsx(HEADERS, rows);
    }

    public static Path writeTemp(byte[] content) {
        try {
            Path file = Files.createTempFile("officeholders-", ".xlsx");
            Files.write(file, content);
            file.toFile().deleteOnExit();
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<String> headersWithout(String header) {
        return HEADERS.stream().filter(h -> !h.equals(header)).toList();
    }
}
