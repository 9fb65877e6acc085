package com.pulpulitiko.importprocessor.domain;

import java.util.List;

/**
 * One field-level problem found in a data row.
 *
 * @param row         1-based sheet row
 * @param field       snake-case field name, e.g. {@code term_end}
 * @param value       the offending value as typed, or empty
 * @param suggestions close catalog values, at most three
 */
public record ValidationError(int row, String field, String message, String value, List<String> suggestions) {

    public ValidationError {
        value = value == null ? "" : value;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ValidationError of(int row, String field, String message, String value) {
        return new ValidationError(row, field, message, value, List.of());
    }
}
