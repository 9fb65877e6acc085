package com.pulpulitiko.importprocessor.reconcile;

import lombok.Getter;

/**
 * A registry call was rejected or could not complete.
 */
@Getter
public class RegistryException extends RuntimeException {

    /** {@code true} when the registry refused the write because the current holder changed. */
    private final boolean conflict;

    public RegistryException(String message, boolean conflict, Throwable cause) {
        super(message, cause);
        this.conflict = conflict;
    }

    public RegistryException(String message, Throwable cause) {
        this(message, false, cause);
    }
}
