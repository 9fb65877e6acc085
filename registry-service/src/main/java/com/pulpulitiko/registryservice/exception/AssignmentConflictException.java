package com.pulpulitiko.registryservice.exception;

/**
 * The write would leave two current holders for one key, or acted on a stale view of the current holder.
 */
public class AssignmentConflictException extends RuntimeException {

    public AssignmentConflictException(String message) {
        super(message);
    }
}
