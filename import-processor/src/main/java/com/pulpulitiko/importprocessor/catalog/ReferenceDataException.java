package com.pulpulitiko.importprocessor.catalog;

/**
 * Reference data could not be fetched. Network or downstream failure, not a data problem.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
