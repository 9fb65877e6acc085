package com.pulpulitiko.importprocessor.service;

import com.pulpulitiko.importprocessor.domain.ImportRun;
import com.pulpulitiko.importprocessor.domain.ImportRunStatus;
import com.pulpulitiko.importprocessor.domain.ReconciliationError;
import com.pulpulitiko.importprocessor.domain.ReconciliationOutcome;
import com.pulpulitiko.importprocessor.domain.ValidationError;
import com.pulpulitiko.importprocessor.dto.ImportRunPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * In-memory import log.
 *
 * <p>The batch job writes to a run while HTTP callers read it, so every method holds the
 * service's monitor and readers receive detached copies.
 */
@Slf4j
@Service
public class ImportRunService {

    /** Creation order. */
    private final Map<String, ImportRun> runs = new LinkedHashMap<>();

    // ─── Lifecycle ───────────────────────────────────────────────────────────

    public synchronized ImportRun create(String filename) {
        ImportRun run = ImportRun.builder()
                .id(UUID.randomUUID().toString())
                .filename(filename)
                .status(ImportRunStatus.PENDING)
                .startedAt(Instant.now())
                .build();
        runs.put(run.getId(), run);
        log.info("Import run {} created for '{}'", run.getId(), filename);
        return snapshot(run);
    }

    public synchronized void attachJob(String runId, String storedFile, Long jobExecutionId) {
        ifPresent(runId, run -> {
            run.setStoredFile(storedFile);
            run.setJobExecutionId(jobExecutionId);
        });
    }

    public synchronized void markProcessing(String runId) {
        ifPresent(runId, run -> run.setStatus(ImportRunStatus.PROCESSING));
    }

    public synchronized void markCompleted(String runId) {
        ifPresent(runId, run -> {
            run.setStatus(ImportRunStatus.COMPLETED);
            run.setCompletedAt(Instant.now());
            log.info("Import run {} COMPLETED: {} rows, {} valid, {} invalid, {} imported, {} failed",
                    runId, run.getTotalRows(), run.getValidRows(), run.getInvalidRows(),
                    run.getSuccessfulImports(), run.getFailedImports());
        });
    }

    public synchronized void markFailed(String runId, String errorLog) {
        ifPresent(runId, run -> {
            run.setStatus(ImportRunStatus.FAILED);
            run.setErrorLog(errorLog);
            run.setCompletedAt(Instant.now());
            log.warn("Import run {} FAILED: {}", runId, errorLog);
        });
    }

    // ─── Progress ────────────────────────────────────────────────────────────

    public synchronized void recordTotalRows(String runId, int totalRows) {
        ifPresent(runId, run -> run.setTotalRows(totalRows));
    }

    /**
     * Rows that failed validation: counted as failed imports, their errors kept in row order.
     */
    public synchronized void recordInvalidRows(String runId, int rowCount, List<ValidationError> errors) {
        ifPresent(runId, run -> {
            run.setInvalidRows(run.getInvalidRows() + rowCount);
            run.setFailedImports(run.getFailedImports() + rowCount);
            run.getValidationErrors().addAll(errors);
        });
    }

    /**
     * Valid rows after reconciliation. A row the registry rejected is still a valid row.
     */
    public synchronized void recordReconciled(String runId, List<ReconciliationOutcome> outcomes,
                                              List<ReconciliationError> errors) {
        ifPresent(runId, run -> {
            run.setValidRows(run.getValidRows() + outcomes.size());
            for (ReconciliationOutcome outcome : outcomes) {
                switch (outcome.action()) {
                    case CREATED -> run.setAssignmentsCreated(run.getAssignmentsCreated() + 1);
                    case UPDATED -> run.setAssignmentsUpdated(run.getAssignmentsUpdated() + 1);
                    case UNCHANGED -> run.setAssignmentsUnchanged(run.getAssignmentsUnchanged() + 1);
                    case ARCHIVED_AND_CREATED -> run.setAssignmentsArchived(run.getAssignmentsArchived() + 1);
                    case FAILED -> run.setFailedImports(run.getFailedImports() + 1);
                }
                if (!outcome.isFailed()) {
                    run.setSuccessfulImports(run.getSuccessfulImports() + 1);
                }
            }
            run.getReconciliationErrors().addAll(errors);
        });
    }

    // ─── Queries ─────────────────────────────────────────────────────────────

    public synchronized Optional<ImportRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(ImportRunService::snapshot);
    }

    /**
     * One page of runs, newest first, without their row errors.
     *
     * @param page    1-based page number
     * @param perPage runs per page, at least 1
     */
    public synchronized ImportRunPage list(int page, int perPage) {
        if (page < 1 || perPage < 1) {
            throw new IllegalArgumentException("page and perPage must be positive, got " + page + "/" + perPage);
        }
        int total = runs.size();
        List<ImportRun> newestFirst = new ArrayList<>(runs.values());
        Collections.reverse(newestFirst);
        List<ImportRun> content = newestFirst.stream()
                .skip((long) (page - 1) * perPage)
                .limit(perPage)
                .map(ImportRunService::summary)
                .toList();
        int totalPages = (total + perPage - 1) / perPage;
        return new ImportRunPage(content, total, page, perPage, totalPages);
    }

    // ─── private helpers ─────────────────────────────────────────────────────

    private void ifPresent(String runId, Consumer<ImportRun> change) {
        if (runId == null) {
            return;
        }
        ImportRun run = runs.get(runId);
        if (run == null) {
            log.warn("Import run {} not found, update ignored", runId);
            return;
        }
        change.accept(run);
    }

    private static ImportRun summary(ImportRun run) {
        return run.toBuilder()
                .validationErrors(new ArrayList<>())
                .reconciliationErrors(new ArrayList<>())
                .build();
    }

    private static ImportRun snapshot(ImportRun run) {
        return run.toBuilder()
                .validationErrors(new ArrayList<>(run.getValidationErrors()))
                .reconciliationErrors(new ArrayList<>(run.getReconciliationErrors()))
                .build();
    }
}
