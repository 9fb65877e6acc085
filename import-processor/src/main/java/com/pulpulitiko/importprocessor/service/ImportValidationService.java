package com.pulpulitiko.importprocessor.service;

import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.catalog.ReferenceCatalogLoader;
import com.pulpulitiko.importprocessor.domain.ImportRunReport;
import com.pulpulitiko.importprocessor.domain.RawRow;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import com.pulpulitiko.importprocessor.domain.ValidationError;
import com.pulpulitiko.importprocessor.spreadsheet.ImportRowMapper;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetFormatException;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetReader;
import com.pulpulitiko.importprocessor.validation.ImportRowValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Dry run: reads and validates a spreadsheet without touching the registry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportValidationService {

    private final SpreadsheetReader spreadsheetReader;
    private final ImportRowMapper rowMapper;
    private final ImportRowValidator validator;
    private final ReferenceCatalogLoader catalogLoader;

    public ImportRunReport validate(InputStream content) throws SpreadsheetFormatException {
        List<RawRow> rows = spreadsheetReader.read(content);
        ReferenceCatalog catalog = catalogLoader.loadCatalog();

        int valid = 0;
        List<ValidationError> errors = new ArrayList<>();
        for (RawRow raw : rows) {
            ValidatedImportRow row = validator.validate(rowMapper.map(raw), catalog);
            if (row.isValid()) {
                valid++;
            } else {
                errors.addAll(row.getErrors());
            }
        }
        log.info("Validated {} rows: {} valid, {} invalid", rows.size(), valid, rows.size() - valid);
        return new ImportRunReport(rows.size(), valid, rows.size() - valid, errors);
    }
}
