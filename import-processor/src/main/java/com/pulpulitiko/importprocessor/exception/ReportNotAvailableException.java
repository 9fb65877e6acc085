package com.pulpulitiko.importprocessor.exception;

import com.pulpulitiko.importprocessor.domain.ImportRunStatus;

/**
 * The error report of a run that is still running, or that failed before any row was read.
 */
public class ReportNotAvailableException extends RuntimeException {

    public ReportNotAvailableException(String importRunId, ImportRunStatus status) {
        super("Import run '%s' is %s; an error report exists only for completed runs.".formatted(importRunId, status));
    }
}
