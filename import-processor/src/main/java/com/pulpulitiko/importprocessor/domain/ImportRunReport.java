package com.pulpulitiko.importprocessor.domain;

import java.util.List;

/**
 * Validation summary of one spreadsheet: counters plus every error, in row order.
 * {@code validRows + invalidRows == totalRows}.
 */
public record ImportRunReport(int totalRows, int validRows, int invalidRows, List<ValidationError> errors) {

    public ImportRunReport {
        errors = List.copyOf(errors);
    }
}
