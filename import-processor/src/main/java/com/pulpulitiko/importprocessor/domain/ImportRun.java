package com.pulpulitiko.importprocessor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Import log entry for one uploaded spreadsheet.
 *
 * <p>A run that ends {@link ImportRunStatus#FAILED} hit a structural error: {@link #errorLog} holds
 * the reason and no rows were processed. A {@link ImportRunStatus#COMPLETED} run always has a
 * report, even when every row failed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ImportRun {

    private String id;

    private String filename;

    /** Where the upload was stored for the batch job to read. */
    private String storedFile;

    @Builder.Default
    private ImportRunStatus status = ImportRunStatus.PENDING;

    private Long jobExecutionId;

    // ── Validation counters ──────────────────────────────────────────────────

    private int totalRows;

    private int validRows;

    private int invalidRows;

    // ── Reconciliation counters ──────────────────────────────────────────────

    /** Rows applied to the registry, including no-op updates. */
    private int successfulImports;

    /** Invalid rows plus rows the registry rejected. */
    private int failedImports;

    private int assignmentsCreated;

    private int assignmentsUpdated;

    private int assignmentsUnchanged;

    private int assignmentsArchived;

    /** Structural failure message; {@code null} unless the run failed. */
    private String errorLog;

    @Builder.Default
    private List<ValidationError> validationErrors = new ArrayList<>();

    @Builder.Default
    private List<ReconciliationError> reconciliationErrors = new ArrayList<>();

    private Instant startedAt;

    private Instant completedAt;
}
