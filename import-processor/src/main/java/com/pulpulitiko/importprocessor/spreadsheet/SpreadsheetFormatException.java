package com.pulpulitiko.importprocessor.spreadsheet;

import lombok.Getter;

/**
 * The uploaded document cannot be processed at all. Fatal to the whole run: no row is touched.
 */
@Getter
public class SpreadsheetFormatException extends Exception {

    public enum Reason {
        MALFORMED_INPUT,
        NO_SHEETS,
        INSUFFICIENT_ROWS,
        MISSING_COLUMN,
        NO_DATA_ROWS
    }

    private final Reason reason;

    /** The missing header for {@link Reason#MISSING_COLUMN}, otherwise {@code null}. */
    private final String column;

    public SpreadsheetFormatException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public SpreadsheetFormatException(Reason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    private SpreadsheetFormatException(Reason reason, String message, String column, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.column = column;
    }

    public static SpreadsheetFormatException missingColumn(String column) {
        return new SpreadsheetFormatException(Reason.MISSING_COLUMN,
                "Missing required column: " + column, column, null);
    }
}
