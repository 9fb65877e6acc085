package com.pulpulitiko.importprocessor.domain;

/**
 * What reconciling one valid row did to the registry.
 */
public enum ReconciliationAction {

    /** The key was vacant; a new current assignment was created. */
    CREATED,

    /** The same politician already held the key; mutable fields were overwritten in place. */
    UPDATED,

    /** The same politician already held the key with identical fields; nothing was written. */
    UNCHANGED,

    /** A different politician held the key; they were archived and the imported one installed. */
    ARCHIVED_AND_CREATED,

    /** The registry rejected or could not complete the write; the registry is unchanged for this row. */
    FAILED
}
