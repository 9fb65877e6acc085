package com.pulpulitiko.importprocessor.batch;

import com.pulpulitiko.importprocessor.domain.ReconciliationError;
import com.pulpulitiko.importprocessor.domain.ReconciliationOutcome;
import com.pulpulitiko.importprocessor.domain.ValidatedImportRow;
import com.pulpulitiko.importprocessor.domain.ValidationError;
import com.pulpulitiko.importprocessor.reconcile.OfficeholderRegistry;
import com.pulpulitiko.importprocessor.reconcile.ReconciliationEngine;
import com.pulpulitiko.importprocessor.service.ImportRunService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies a chunk of validated rows:
 * <ul>
 *   <li>invalid rows: their {@link ValidationError}s go to the import run</li>
 *   <li>valid rows: reconciled against the registry in row order; rejected writes become
 *       {@link ReconciliationError}s</li>
 * </ul>
 *
 * <p>One {@link ReconciliationEngine} lives for the whole step, so rows in later chunks see the
 * holders written by earlier ones. Created as a {@code @StepScope} bean in
 * {@link com.pulpulitiko.importprocessor.config.BatchConfig}.
 */
@Slf4j
public class ReconciliationItemWriter implements ItemStreamWriter<ValidatedImportRow> {

    private final ImportRunService importRunService;
    private final String importRunId;
    private final ReconciliationEngine engine;

    private int invalidCount;
    private int appliedCount;
    private int failedCount;

    public ReconciliationItemWriter(OfficeholderRegistry registry, ImportRunService importRunService,
                                    String importRunId) {
        this.importRunService = importRunService;
        this.importRunId = importRunId;
        this.engine = new ReconciliationEngine(registry);
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        log.info("Reconciling import run {}", importRunId);
    }

    @Override
    public void write(Chunk<? extends ValidatedImportRow> chunk) {
        List<ValidatedImportRow> validRows = new ArrayList<>();
        List<ValidationError> validationErrors = new ArrayList<>();
        int invalidRows = 0;
        for (ValidatedImportRow row : chunk.getItems()) {
            if (row.isValid()) {
                validRows.add(row);
            } else {
                invalidRows++;
                validationErrors.addAll(row.getErrors());
            }
        }
        if (invalidRows > 0) {
            importRunService.recordInvalidRows(importRunId, invalidRows, validationErrors);
            invalidCount += invalidRows;
        }
        if (validRows.isEmpty()) {
            return;
        }

        List<ReconciliationOutcome> outcomes = engine.reconcileAll(validRows);
        Map<Integer, ValidatedImportRow> byRow = validRows.stream()
                .collect(Collectors.toMap(ValidatedImportRow::getRowNumber, Function.identity()));
        List<ReconciliationError> reconciliationErrors = outcomes.stream()
                .filter(ReconciliationOutcome::isFailed)
                .map(outcome -> toError(byRow.get(outcome.row()), outcome))
                .toList();

        importRunService.recordReconciled(importRunId, outcomes, reconciliationErrors);
        failedCount += reconciliationErrors.size();
        appliedCount += outcomes.size() - reconciliationErrors.size();
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        // nothing to checkpoint
    }

    @Override
    public void close() throws ItemStreamException {
        log.info("Import run {} written: {} applied, {} rejected by the registry, {} invalid",
                importRunId, appliedCount, failedCount, invalidCount);
    }

    // ─── helper ──────────────────────────────────────────────────────────────

    private static ReconciliationError toError(ValidatedImportRow row, ReconciliationOutcome outcome) {
        return new ReconciliationError(
                outcome.row(),
                row.getPositionName(),
                row.getJurisdiction().type().wireValue(),
                row.getJurisdiction().isNational() ? "" : row.getJurisdictionName(),
                outcome.message());
    }
}
