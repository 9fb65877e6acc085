package com.pulpulitiko.importprocessor.domain;

/**
 * A valid row the registry could not apply. Reported apart from validation errors
 * because the data was fine; the row can be retried on its own.
 */
public record ReconciliationError(int row, String position, String jurisdictionType, String jurisdictionName,
                                  String message) {
}
