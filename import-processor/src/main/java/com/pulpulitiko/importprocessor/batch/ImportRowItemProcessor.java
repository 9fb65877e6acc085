package com.pulpulitiko.importprocessor.batch;

import com.pulpulitiko.importprocessor.catalog.ReferenceCatalog;
import com.pulpulitiko.importprocessor.catalog.ReferenceCatalogLoader;
import com.pulpulitiko.importprocessor.domain.RawRow;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import com.pulpulitiko.importprocessor.spreadsheet.ImportRowMapper;
import com.pulpulitiko.importprocessor.validation.ImportRowValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;

/**
 * Maps and validates each {@link RawRow}.
 *
 * <p>The reference catalog is loaded on the first row and reused for the rest of the step, so
 * every row of a run is checked against the same snapshot. If the catalog cannot be loaded the
 * {@link com.pulpulitiko.importprocessor.catalog.ReferenceDataException} fails the step.
 *
 * <p>Invalid rows are <em>not</em> filtered out; {@link ValidatedImportRow#isValid()} is
 * {@code false} and the writer records their errors.
 */
@Slf4j
public class ImportRowItemProcessor implements ItemProcessor<RawRow, ValidatedImportRow> {

    private final ImportRowMapper rowMapper;
    private final ImportRowValidator validator;
    private final ReferenceCatalogLoader catalogLoader;

    private ReferenceCatalog catalog;

    public ImportRowItemProcessor(ImportRowMapper rowMapper, ImportRowValidator validator,
                                  ReferenceCatalogLoader catalogLoader) {
        this.rowMapper = rowMapper;
        this.validator = validator;
        this.catalogLoader = catalogLoader;
    }

    @Override
    public ValidatedImportRow process(RawRow raw) {
        if (catalog == null) {
            catalog = catalogLoader.loadCatalog();
        }
        return validator.validate(rowMapper.map(raw), catalog);
    }
}
