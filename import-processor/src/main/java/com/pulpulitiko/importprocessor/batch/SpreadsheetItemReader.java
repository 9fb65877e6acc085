package com.pulpulitiko.importprocessor.batch;

import com.pulpulitiko.importprocessor.domain.RawRow;
import com.pulpulitiko.importprocessor.service.ImportRunService;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetFormatException;
import com.pulpulitiko.importprocessor.spreadsheet.SpreadsheetReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamReader;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the uploaded spreadsheet as a stream of {@link RawRow}s.
 *
 * <p>The whole document is parsed in {@link #open}, so a structural problem (unreadable file,
 * missing column, no data rows) fails the step before a single row reaches the processor.
 * The read position is kept in the {@link ExecutionContext} under {@code spreadsheet.read.count}.
 *
 * <p>Not a {@code @Component}: created per step execution by
 * {@link com.pulpulitiko.importprocessor.config.BatchConfig}.
 */
@Slf4j
public class SpreadsheetItemReader implements ItemStreamReader<RawRow> {

    static final String READ_COUNT_KEY = "spreadsheet.read.count";

    private final SpreadsheetReader spreadsheetReader;
    private final Resource resource;
    private final ImportRunService importRunService;
    private final String importRunId;

    private List<RawRow> rows = List.of();
    private int next;

    public SpreadsheetItemReader(SpreadsheetReader spreadsheetReader, Resource resource,
                                 ImportRunService importRunService, String importRunId) {
        this.spreadsheetReader = spreadsheetReader;
        this.resource = resource;
        this.importRunService = importRunService;
        this.importRunId = importRunId;
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        try (InputStream in = resource.getInputStream()) {
            rows = spreadsheetReader.read(in);
        } catch (SpreadsheetFormatException e) {
            throw new ItemStreamException(e.getMessage(), e);
        } catch (IOException e) {
            throw new ItemStreamException("Cannot read input file '%s'".formatted(resource.getDescription()), e);
        }
        next = executionContext.getInt(READ_COUNT_KEY, 0);
        importRunService.recordTotalRows(importRunId, rows.size());
        log.info("Spreadsheet '{}' has {} data rows", resource.getFilename(), rows.size());
    }

    @Override
    public RawRow read() {
        return next < rows.size() ? rows.get(next++) : null;
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        executionContext.putInt(READ_COUNT_KEY, next);
    }

    @Override
    public void close() throws ItemStreamException {
        rows = List.of();
    }
}
